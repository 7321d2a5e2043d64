package com.rechargeengine.core.detection;

import com.rechargeengine.core.SyntheticSeries;
import com.rechargeengine.core.config.QualityWeights;
import com.rechargeengine.core.model.CrossValidationMethod;
import com.rechargeengine.core.model.CrossValidationResult;
import com.rechargeengine.core.model.CurveType;
import com.rechargeengine.core.model.MasterCurve;
import com.rechargeengine.core.model.RechargeEvent;
import com.rechargeengine.core.model.RecessionSegment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EventQualityScorer}.
 *
 * <p>
 * Expected scores assume the default {@link QualityWeights} (0.4 magnitude,
 * 0.3 cross-validation, 0.3 seasonal). They pin the configured defaults, not
 * a reference weighting.
 * </p>
 */
class EventQualityScorerTest {

    private EventQualityScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new EventQualityScorer(new QualityWeights(), 0.1);
    }

    @Test
    @DisplayName("Should use a neutral agreement term without cross-validation")
    void shouldScoreWithoutCrossValidation() {
        List<RechargeEvent> scored = scorer.score(List.of(event(LocalDateTime.of(2020, 1, 10, 0, 0), 1.0)),
                List.of(), null);

        assertThat(scored).hasSize(1);
        assertThat(scored.get(0).getQualityScore()).isCloseTo(0.85, within(1e-12));
        assertThat(scored.get(0).getValidated()).isTrue();
    }

    @Test
    @DisplayName("Should lower the score of small events in an unusual season")
    void shouldPenaliseUnusualSeason() {
        List<RechargeEvent> scored = scorer.score(List.of(
                event(LocalDateTime.of(2020, 1, 10, 0, 0), 1.0),
                event(LocalDateTime.of(2020, 2, 10, 0, 0), 1.0),
                event(LocalDateTime.of(2020, 7, 10, 0, 0), 0.25)), List.of(), null);

        assertThat(scored.get(1).getQualityScore()).isCloseTo(0.85, within(1e-12));
        assertThat(scored.get(2).getQualityScore()).isCloseTo(0.45, within(1e-12));
        assertThat(scored.get(2).getValidated()).isFalse();
    }

    @Test
    @DisplayName("Should reward fold curves that agree with the full curve")
    void shouldRewardAgreement() {
        MasterCurve full = exponential(0.05);
        RecessionSegment segment = SyntheticSeries.exponentialSegment(SyntheticSeries.START, 10.0, 0.05, 10);
        LocalDateTime date = SyntheticSeries.START.plusDays(10);
        double baseline = AnchoredBaseline.baseline(full, segment, date);
        RechargeEvent event = RechargeEvent.builder()
                .eventDate(date)
                .observedLevel(10.0)
                .baselineLevel(baseline)
                .deviation(10.0 - baseline)
                .rechargeInches(1.0)
                .build();

        double agreeing = scorer.score(List.of(event), List.of(segment), crossValidation(full))
                .get(0).getQualityScore();
        double disagreeing = scorer.score(List.of(event), List.of(segment), crossValidation(exponential(0.1)))
                .get(0).getQualityScore();

        assertThat(agreeing).isCloseTo(1.0, within(1e-9));
        double gapShare = (Math.exp(-0.5) - Math.exp(-1.0)) / (1.0 - Math.exp(-0.5));
        assertThat(disagreeing).isCloseTo(0.7 + 0.3 * (1.0 - gapShare), within(1e-9));
    }

    @Test
    @DisplayName("Should give full magnitude credit when the threshold is zero")
    void shouldHandleZeroThreshold() {
        assertThat(new EventQualityScorer(new QualityWeights(), 0.0).magnitudeScore(0.01)).isEqualTo(1.0);
        assertThat(scorer.magnitudeScore(0.25)).isCloseTo(0.5, within(1e-12));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static RechargeEvent event(LocalDateTime date, double deviation) {
        return RechargeEvent.builder()
                .eventDate(date)
                .observedLevel(10.0)
                .baselineLevel(10.0 - deviation)
                .deviation(deviation)
                .rechargeInches(deviation * 2.4)
                .build();
    }

    private static MasterCurve exponential(double a) {
        return MasterCurve.builder()
                .curveType(CurveType.EXPONENTIAL)
                .parameters(Map.of("L0", 10.0, "a", a))
                .build();
    }

    private static CrossValidationResult crossValidation(MasterCurve foldCurve) {
        return new CrossValidationResult(CrossValidationMethod.K_FOLD, List.of(1.0), 1.0, 1.0, List.of(foldCurve));
    }
}
