package com.rechargeengine.core.aggregation;

import com.rechargeengine.core.model.CurveType;
import com.rechargeengine.core.model.MasterCurve;
import com.rechargeengine.core.model.Reading;
import com.rechargeengine.core.model.RechargeEvent;
import com.rechargeengine.core.model.RechargeMethod;
import com.rechargeengine.core.model.Season;
import com.rechargeengine.core.model.SeasonalSummary;
import com.rechargeengine.core.model.TimeSeries;
import com.rechargeengine.core.model.YearlySummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Aggregator}.
 */
class AggregatorTest {

    private static final LocalDateTime SEP_30 = LocalDateTime.of(2020, 9, 30, 0, 0);
    private static final LocalDateTime OCT_5 = LocalDateTime.of(2020, 10, 5, 0, 0);
    private static final LocalDateTime OCT_15 = LocalDateTime.of(2020, 10, 15, 0, 0);

    private Aggregator aggregator;
    private List<RechargeEvent> events;
    private TimeSeries series;

    @BeforeEach
    void setUp() {
        aggregator = new Aggregator();
        events = List.of(
                event(SEP_30, 2020, 0.5, 0.2, 0.6),
                event(OCT_5, 2021, 1.0, 0.4, 0.8),
                event(OCT_15, 2021, 2.0, 0.8, 0.4));
        series = new TimeSeries(List.of(new Reading(SEP_30, 5.0), new Reading(OCT_15, 5.0)));
    }

    @Test
    @DisplayName("Should summarise each water year in order")
    void shouldSummariseWaterYears() {
        Aggregation aggregation = aggregator.aggregate(events, series, RechargeMethod.MRC, null);

        List<YearlySummary> yearly = aggregation.getYearlySummaries();
        assertThat(yearly).extracting(YearlySummary::getWaterYear).containsExactly(2020, 2021);

        YearlySummary first = yearly.get(0);
        assertThat(first.getEventCount()).isEqualTo(1);
        assertThat(first.getAnnualRate()).isCloseTo(182.5, within(1e-9));

        YearlySummary second = yearly.get(1);
        assertThat(second.getEventCount()).isEqualTo(2);
        assertThat(second.getTotalRecharge()).isCloseTo(3.0, within(1e-12));
        assertThat(second.getMaxDeviation()).isCloseTo(0.8, within(1e-12));
        assertThat(second.getAvgDeviation()).isCloseTo(0.6, within(1e-12));
        assertThat(second.getAnnualRate()).isCloseTo(109.5, within(1e-9));
        assertThat(second.getAverageQualityScore()).isNull();
    }

    @Test
    @DisplayName("Should scale the overall rate by the span of the series")
    void shouldComputeOverallRate() {
        Aggregation aggregation = aggregator.aggregate(events, series, RechargeMethod.RISE, null);

        assertThat(aggregation.getTotalRecharge()).isCloseTo(3.5, within(1e-12));
        assertThat(aggregation.getAnnualRate()).isCloseTo(3.5 * 365.0 / 15.0, within(1e-9));
        assertThat(aggregation.getSeasonalSummaries()).isNull();
        assertThat(aggregation.getParameterVariability()).isNull();
    }

    @Test
    @DisplayName("Should add seasonal summaries and average quality for ERC")
    void shouldAddExtendedSummaries() {
        Aggregation aggregation = aggregator.aggregate(events, series, RechargeMethod.ERC, null);

        List<SeasonalSummary> seasonal = aggregation.getSeasonalSummaries();
        assertThat(seasonal).hasSize(1);
        assertThat(seasonal.get(0).getSeason()).isEqualTo(Season.FALL);
        assertThat(seasonal.get(0).getEventCount()).isEqualTo(3);
        assertThat(seasonal.get(0).getTotalRecharge()).isCloseTo(3.5, within(1e-12));
        assertThat(aggregation.getYearlySummaries().get(1).getAverageQualityScore()).isCloseTo(0.6, within(1e-12));
    }

    @Test
    @DisplayName("Should report an empty summary when there are no events")
    void shouldHandleNoEvents() {
        Aggregation aggregation = aggregator.aggregate(List.of(), series, RechargeMethod.ERC, null);

        assertThat(aggregation.getYearlySummaries()).isEmpty();
        assertThat(aggregation.getSeasonalSummaries()).isEmpty();
        assertThat(aggregation.getTotalRecharge()).isZero();
        assertThat(aggregation.getAnnualRate()).isZero();
    }

    @Test
    @DisplayName("Should measure parameter variability across partitions")
    void shouldMeasureParameterVariability() {
        Map<String, MasterCurve> partitions = new LinkedHashMap<>();
        partitions.put("WINTER", exponential(0.04));
        partitions.put("SUMMER", exponential(0.06));
        MasterCurve multi = MasterCurve.builder()
                .curveType(CurveType.MULTI_SEGMENT)
                .baseCurveType(CurveType.EXPONENTIAL)
                .parameters(Map.of("L0", 10.0, "a", 0.05))
                .partitions(partitions)
                .build();

        Map<String, Double> variability = aggregator.parameterVariability(multi);

        assertThat(variability).containsOnlyKeys("L0", "a");
        assertThat(variability.get("L0")).isZero();
        assertThat(variability.get("a")).isCloseTo(0.28284, within(1e-5));
        assertThat(aggregator.parameterVariability(exponential(0.05))).isNull();
    }

    @Test
    @DisplayName("Should treat a zero-day span as one day")
    void shouldHandleZeroSpan() {
        assertThat(Aggregator.annualRate(2.0, 0.0)).isEqualTo(730.0);
        assertThat(Aggregator.annualRate(2.0, 730.0)).isEqualTo(1.0);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static RechargeEvent event(LocalDateTime date, int waterYear, double inches, double deviation,
            double quality) {
        return RechargeEvent.builder()
                .eventDate(date)
                .waterYear(waterYear)
                .observedLevel(5.0 + deviation)
                .baselineLevel(5.0)
                .deviation(deviation)
                .rechargeInches(inches)
                .qualityScore(quality)
                .validated(true)
                .build();
    }

    private static MasterCurve exponential(double a) {
        return MasterCurve.builder()
                .curveType(CurveType.EXPONENTIAL)
                .parameters(Map.of("L0", 10.0, "a", a))
                .build();
    }
}
