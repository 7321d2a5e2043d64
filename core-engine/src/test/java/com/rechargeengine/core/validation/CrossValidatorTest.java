package com.rechargeengine.core.validation;

import com.rechargeengine.core.SyntheticSeries;
import com.rechargeengine.core.config.CalculationParameters;
import com.rechargeengine.core.fitting.CurveFitter;
import com.rechargeengine.core.model.CrossValidationMethod;
import com.rechargeengine.core.model.CrossValidationResult;
import com.rechargeengine.core.model.MasterCurve;
import com.rechargeengine.core.model.RecessionSegment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CrossValidator}.
 */
class CrossValidatorTest {

    private CurveFitter fitter;
    private CrossValidator validator;
    private CalculationParameters parameters;

    @BeforeEach
    void setUp() {
        fitter = new CurveFitter();
        validator = new CrossValidator(fitter);
        parameters = new CalculationParameters();
    }

    @Test
    @DisplayName("Should split into contiguous blocks with larger blocks first")
    void shouldSplitKFold() {
        parameters.setFoldCount(3);

        List<List<Integer>> holdOuts = CrossValidator.holdOutIndices(7, parameters);

        assertThat(holdOuts).containsExactly(List.of(0, 1, 2), List.of(3, 4), List.of(5, 6));
    }

    @Test
    @DisplayName("Should clamp the fold count to the number of segments")
    void shouldClampFoldCount() {
        assertThat(CrossValidator.holdOutIndices(3, parameters)).hasSize(3);
    }

    @Test
    @DisplayName("Should shuffle reproducibly with a seed")
    void shouldShuffleWithSeed() {
        parameters.setCrossValidationSeed(42L);

        List<List<Integer>> first = CrossValidator.holdOutIndices(10, parameters);
        List<List<Integer>> second = CrossValidator.holdOutIndices(10, parameters);

        assertThat(first).isEqualTo(second);
        assertThat(first.stream().flatMap(List::stream)).containsExactlyInAnyOrder(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        first.forEach(block -> assertThat(block).isSorted().hasSize(2));
    }

    @Test
    @DisplayName("Should hold out each segment once for leave-one-out")
    void shouldLeaveOneOut() {
        parameters.setCrossValidationMethod(CrossValidationMethod.LEAVE_ONE_OUT);

        assertThat(CrossValidator.holdOutIndices(4, parameters))
                .containsExactly(List.of(0), List.of(1), List.of(2), List.of(3));
    }

    @Test
    @DisplayName("Should hold out the latest segments for a temporal split")
    void shouldSplitTemporally() {
        parameters.setCrossValidationMethod(CrossValidationMethod.TEMPORAL_SPLIT);

        assertThat(CrossValidator.holdOutIndices(10, parameters)).containsExactly(List.of(7, 8, 9));

        parameters.setTemporalTrainFraction(0.99);
        assertThat(CrossValidator.holdOutIndices(2, parameters)).containsExactly(List.of(1));
    }

    @Test
    @DisplayName("Should score consistent recessions near 1 in every fold")
    void shouldValidateConsistentRecessions() {
        List<RecessionSegment> segments = segments(0.05, 0.05, 0.05, 0.05, 0.05);
        MasterCurve full = fitter.fit(segments, parameters);

        CrossValidationResult result = validator.validate(segments, full, parameters);

        assertThat(result.getMethod()).isEqualTo(CrossValidationMethod.K_FOLD);
        assertThat(result.getFoldCount()).isEqualTo(5);
        assertThat(result.getFoldCurves()).hasSize(5);
        assertThat(result.getMeanRSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getFullDataRSquared()).isEqualTo(full.getRSquared());
        assertThat(result.isDegraded()).isFalse();
    }

    @Test
    @DisplayName("Should flag a curve that does not generalize")
    void shouldFlagDegradation() {
        parameters.setCrossValidationMethod(CrossValidationMethod.TEMPORAL_SPLIT);
        parameters.setTemporalTrainFraction(0.75);
        List<RecessionSegment> segments = segments(0.01, 0.01, 0.01, 0.2);
        MasterCurve full = fitter.fit(segments, parameters);

        CrossValidationResult result = validator.validate(segments, full, parameters);

        assertThat(result.getFoldCount()).isEqualTo(1);
        assertThat(result.getMeanRSquared()).isLessThan(0.0);
        assertThat(result.isDegraded()).isTrue();
    }

    @Test
    @DisplayName("Should report the same folds when run in parallel")
    void shouldMatchSequentialWhenParallel() {
        List<RecessionSegment> segments = segments(0.04, 0.05, 0.06, 0.05, 0.045, 0.055);
        MasterCurve full = fitter.fit(segments, parameters);

        CrossValidationResult sequential = validator.validate(segments, full, parameters);
        parameters.setParallel(true);
        CrossValidationResult parallel = validator.validate(segments, full, parameters);

        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    @DisplayName("Should require at least two segments")
    void shouldRequireTwoSegments() {
        List<RecessionSegment> segments = segments(0.05);
        MasterCurve full = fitter.fit(segments, parameters, 1);

        assertThatThrownBy(() -> validator.validate(segments, full, parameters))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<RecessionSegment> segments(double... rates) {
        List<RecessionSegment> segments = new ArrayList<>();
        for (int i = 0; i < rates.length; i++) {
            segments.add(SyntheticSeries.exponentialSegment(SyntheticSeries.START.plusDays(30L * i), 10.0,
                    rates[i], 20));
        }
        return segments;
    }
}
