package com.rechargeengine.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.rechargeengine.core.config.CalculationParameters;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one recharge calculation produced.
 *
 * <p>
 * Immutable once built. Components that do not apply to the method are
 * {@code null}: the rise method has no master curve, and cross-validation,
 * seasonal summaries and parameter variability are specific to the extended
 * recession curve method.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = CalculationResult.Builder.class)
public final class CalculationResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final RechargeMethod method;
    private final CalculationParameters parameters;
    private final List<RecessionSegment> segments;
    private final MasterCurve masterCurve;
    private final CrossValidationResult crossValidation;
    private final List<RechargeEvent> events;
    private final List<YearlySummary> yearlySummaries;
    private final List<SeasonalSummary> seasonalSummaries;
    private final Map<String, Double> seasonalParameterVariability;
    private final double totalRecharge;
    private final double annualRate;
    private final QualityReport quality;
    private final List<String> warnings;

    private CalculationResult(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "method must not be null");
        this.parameters = Objects.requireNonNull(builder.parameters, "parameters must not be null").copy();
        this.segments = copyOrEmpty(builder.segments);
        this.masterCurve = builder.masterCurve;
        this.crossValidation = builder.crossValidation;
        this.events = copyOrEmpty(builder.events);
        this.yearlySummaries = copyOrEmpty(builder.yearlySummaries);
        this.seasonalSummaries = builder.seasonalSummaries != null ? List.copyOf(builder.seasonalSummaries) : null;
        this.seasonalParameterVariability = builder.seasonalParameterVariability != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.seasonalParameterVariability))
                : null;
        this.totalRecharge = builder.totalRecharge;
        this.annualRate = builder.annualRate;
        this.quality = Objects.requireNonNull(builder.quality, "quality must not be null");
        this.warnings = copyOrEmpty(builder.warnings);
    }

    private static <T> List<T> copyOrEmpty(List<T> list) {
        return list != null ? List.copyOf(list) : List.of();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link CalculationResult}; also used by Jackson.
     * {@code method}, {@code parameters} and {@code quality} are required.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private RechargeMethod method;
        private CalculationParameters parameters;
        private List<RecessionSegment> segments;
        private MasterCurve masterCurve;
        private CrossValidationResult crossValidation;
        private List<RechargeEvent> events;
        private List<YearlySummary> yearlySummaries;
        private List<SeasonalSummary> seasonalSummaries;
        private Map<String, Double> seasonalParameterVariability;
        private double totalRecharge;
        private double annualRate;
        private QualityReport quality;
        private List<String> warnings;

        public Builder method(RechargeMethod method) {
            this.method = method;
            return this;
        }

        public Builder parameters(CalculationParameters parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder segments(List<RecessionSegment> segments) {
            this.segments = segments;
            return this;
        }

        public Builder masterCurve(MasterCurve masterCurve) {
            this.masterCurve = masterCurve;
            return this;
        }

        public Builder crossValidation(CrossValidationResult crossValidation) {
            this.crossValidation = crossValidation;
            return this;
        }

        public Builder events(List<RechargeEvent> events) {
            this.events = events;
            return this;
        }

        public Builder yearlySummaries(List<YearlySummary> yearlySummaries) {
            this.yearlySummaries = yearlySummaries;
            return this;
        }

        public Builder seasonalSummaries(List<SeasonalSummary> seasonalSummaries) {
            this.seasonalSummaries = seasonalSummaries;
            return this;
        }

        public Builder seasonalParameterVariability(Map<String, Double> seasonalParameterVariability) {
            this.seasonalParameterVariability = seasonalParameterVariability;
            return this;
        }

        public Builder totalRecharge(double totalRecharge) {
            this.totalRecharge = totalRecharge;
            return this;
        }

        public Builder annualRate(double annualRate) {
            this.annualRate = annualRate;
            return this;
        }

        public Builder quality(QualityReport quality) {
            this.quality = quality;
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings = warnings;
            return this;
        }

        public CalculationResult build() {
            return new CalculationResult(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public RechargeMethod getMethod() {
        return method;
    }

    /**
     * @return a copy of the parameters the calculation ran with
     */
    public CalculationParameters getParameters() {
        return parameters.copy();
    }

    public List<RecessionSegment> getSegments() {
        return segments;
    }

    public MasterCurve getMasterCurve() {
        return masterCurve;
    }

    public CrossValidationResult getCrossValidation() {
        return crossValidation;
    }

    public List<RechargeEvent> getEvents() {
        return events;
    }

    public List<YearlySummary> getYearlySummaries() {
        return yearlySummaries;
    }

    public List<SeasonalSummary> getSeasonalSummaries() {
        return seasonalSummaries;
    }

    public Map<String, Double> getSeasonalParameterVariability() {
        return seasonalParameterVariability;
    }

    /**
     * @return summed recharge of all events, in inches
     */
    public double getTotalRecharge() {
        return totalRecharge;
    }

    /**
     * @return total recharge scaled to inches per year over the record length
     */
    public double getAnnualRate() {
        return annualRate;
    }

    public QualityReport getQuality() {
        return quality;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CalculationResult that))
            return false;
        return Double.compare(totalRecharge, that.totalRecharge) == 0
                && Double.compare(annualRate, that.annualRate) == 0
                && method == that.method
                && parameters.equals(that.parameters)
                && segments.equals(that.segments)
                && Objects.equals(masterCurve, that.masterCurve)
                && Objects.equals(crossValidation, that.crossValidation)
                && events.equals(that.events)
                && yearlySummaries.equals(that.yearlySummaries)
                && Objects.equals(seasonalSummaries, that.seasonalSummaries)
                && Objects.equals(seasonalParameterVariability, that.seasonalParameterVariability)
                && quality.equals(that.quality)
                && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, events, totalRecharge, annualRate);
    }

    @Override
    public String toString() {
        return "CalculationResult{" +
                "method=" + method +
                ", segments=" + segments.size() +
                ", events=" + events.size() +
                ", totalRecharge=" + totalRecharge +
                ", annualRate=" + annualRate +
                ", quality=" + quality +
                ", warnings=" + warnings +
                '}';
    }
}
