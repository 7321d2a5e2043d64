package com.rechargeengine.core.engine;

import com.rechargeengine.core.SyntheticSeries;
import com.rechargeengine.core.config.CalculationParameters;
import com.rechargeengine.core.exception.InsufficientSegmentsException;
import com.rechargeengine.core.exception.ValidationException;
import com.rechargeengine.core.model.CalculationResult;
import com.rechargeengine.core.model.CurveType;
import com.rechargeengine.core.model.RechargeEvent;
import com.rechargeengine.core.model.RechargeMethod;
import com.rechargeengine.core.model.TimeSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end tests for {@link RechargeEngine}.
 */
class RechargeEngineTest {

    private RechargeEngine engine;
    private CalculationParameters parameters;

    @BeforeEach
    void setUp() {
        engine = new RechargeEngine();
        parameters = new CalculationParameters();
    }

    @Test
    @DisplayName("Should find both rises with the master recession curve method")
    void shouldCalculateMrc() {
        CalculationResult result = engine.calculate(SyntheticSeries.twoRiseScenario(), parameters);

        assertThat(result.getMethod()).isEqualTo(RechargeMethod.MRC);
        assertThat(result.getSegments()).hasSize(3);
        assertThat(result.getMasterCurve()).isNotNull();
        assertThat(result.getCrossValidation()).isNull();
        assertThat(result.getEvents()).extracting(RechargeEvent::getEventDate)
                .containsExactly(SyntheticSeries.START.plusDays(30), SyntheticSeries.START.plusDays(60));
        for (RechargeEvent event : result.getEvents()) {
            assertThat(event.getRechargeInches()).isCloseTo(2.4, within(0.15));
            assertThat(event.getRechargeInches()).isCloseTo(event.getDeviation() * 0.2 * 12.0, within(1e-12));
            assertThat(event.getWaterYear()).isEqualTo(2020);
            assertThat(event.getQualityScore()).isNull();
        }
        assertThat(result.getTotalRecharge()).isCloseTo(
                result.getEvents().get(0).getRechargeInches() + result.getEvents().get(1).getRechargeInches(),
                within(1e-12));
        assertThat(result.getYearlySummaries()).hasSize(1);
        assertThat(result.getSeasonalSummaries()).isNull();
        assertThat(result.getQuality().getOverallScore()).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("Should find only the recharge jumps when clean recessions are fitted with a power law")
    void shouldFindOnlyJumpsWithPowerCurve() {
        parameters.setCurveType(CurveType.POWER);

        CalculationResult result = engine.calculate(SyntheticSeries.repeatedRecessions(12, 30, 0.02), parameters);

        assertThat(result.getMasterCurve().getCurveType()).isEqualTo(CurveType.POWER);
        List<LocalDateTime> jumps = new ArrayList<>();
        for (int k = 1; k < 12; k++) {
            jumps.add(SyntheticSeries.START.plusDays(30L * k));
        }
        assertThat(result.getEvents()).extracting(RechargeEvent::getEventDate).containsExactlyElementsOf(jumps);
    }

    @Test
    @DisplayName("Should warn when the master curve fit is below minCurveRSquared")
    void shouldWarnAboutPoorCurveFit() {
        parameters.setCurveType(CurveType.POWER);
        parameters.setMinCurveRSquared(1.0);

        CalculationResult result = engine.calculate(SyntheticSeries.repeatedRecessions(12, 30, 0.02), parameters);

        assertThat(result.getMasterCurve().getRSquared()).isLessThan(1.0);
        assertThat(result.getWarnings()).anySatisfy(warning -> assertThat(warning).contains("is below 1.00"));
    }

    @Test
    @DisplayName("Should find both rises with the water-table rise method")
    void shouldCalculateRise() {
        parameters.setMethod(RechargeMethod.RISE);

        CalculationResult result = engine.calculate(SyntheticSeries.twoRiseScenario(), parameters);

        assertThat(result.getMasterCurve()).isNull();
        assertThat(result.getSegments()).isEmpty();
        assertThat(result.getEvents()).extracting(RechargeEvent::getEventDate)
                .containsExactly(SyntheticSeries.START.plusDays(30), SyntheticSeries.START.plusDays(60));
        assertThat(result.getEvents().get(0).getRechargeInches()).isCloseTo(2.424, within(0.01));
        assertThat(result.getQuality().getOverallScore()).isNull();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should score events and cross-validate with the extended recession curve method")
    void shouldCalculateErc() {
        parameters.setMethod(RechargeMethod.ERC);

        CalculationResult result = engine.calculate(SyntheticSeries.twoRiseScenario(), parameters);

        assertThat(result.getCrossValidation()).isNotNull();
        assertThat(result.getCrossValidation().getFoldCount()).isEqualTo(3);
        assertThat(result.getEvents()).hasSize(2);
        assertThat(result.getEvents()).allSatisfy(event -> {
            assertThat(event.getQualityScore()).isBetween(0.0, 1.0);
            assertThat(event.getValidated()).isNotNull();
        });
        assertThat(result.getSeasonalSummaries()).isNotEmpty();
        assertThat(result.getYearlySummaries().get(0).getAverageQualityScore()).isNotNull();
        assertThat(result.getQuality().getMeanCrossValidationRSquared()).isNotNull();
        assertThat(result.getQuality().getOverallScore()).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("Should warn instead of failing when no recession segments exist")
    void shouldWarnWithoutSegments() {
        TimeSeries rising = SyntheticSeries.daily(SyntheticSeries.linear(5.0, 0.01, 60));

        CalculationResult result = engine.calculate(rising, parameters);

        assertThat(result.getSegments()).isEmpty();
        assertThat(result.getEvents()).isEmpty();
        assertThat(result.getMasterCurve()).isNull();
        assertThat(result.getTotalRecharge()).isZero();
        assertThat(result.getWarnings()).hasSize(1);
        assertThat(result.getWarnings().get(0)).contains("No recession segments");
        assertThat(result.getQuality().getOverallScore()).isNull();
    }

    @Test
    @DisplayName("Should fail when too few segments exist for a curve")
    void shouldFailWithTooFewSegments() {
        TimeSeries single = SyntheticSeries.daily(SyntheticSeries.linear(10.0, -0.01, 60));

        assertThatThrownBy(() -> engine.calculate(single, parameters))
                .isInstanceOf(InsufficientSegmentsException.class);
    }

    @Test
    @DisplayName("Should warn about short records and missing events")
    void shouldWarnAboutShortRecord() {
        parameters.setMethod(RechargeMethod.RISE);

        CalculationResult result = engine.calculate(SyntheticSeries.daily(SyntheticSeries.linear(10.0, -0.01, 10)),
                parameters);

        assertThat(result.getWarnings()).anySatisfy(w -> assertThat(w).startsWith("Record spans 9.0 days"));
        assertThat(result.getWarnings()).anySatisfy(w -> assertThat(w).contains("No recharge events"));
    }

    @Test
    @DisplayName("Should reject invalid parameters before any work")
    void shouldRejectInvalidParameters() {
        parameters.setSpecificYield(0.0);

        assertThatThrownBy(() -> engine.calculate(SyntheticSeries.twoRiseScenario(), parameters))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("specificYield");
    }

    @Test
    @DisplayName("Should leave the caller's parameters untouched")
    void shouldNotMutateParameters() {
        CalculationParameters before = parameters.copy();

        CalculationResult result = engine.calculate(SyntheticSeries.twoRiseScenario(), parameters);

        assertThat(parameters).isEqualTo(before);
        assertThat(result.getParameters()).isEqualTo(before);
    }
}
