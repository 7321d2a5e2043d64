package com.rechargeengine.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A detected recharge event: a reading whose water level stands above the
 * expected baseline by more than the configured threshold.
 *
 * <p>
 * {@code rechargeInches} is always {@code deviation * specificYield * 12}.
 * {@code qualityScore} and {@code validated} are only populated by the
 * extended recession curve method.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = RechargeEvent.Builder.class)
public final class RechargeEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDateTime eventDate;
    private final Integer waterYear;
    private final Season season;
    private final double observedLevel;
    private final double baselineLevel;
    private final double deviation;
    private final double rechargeInches;
    private final EventMagnitude magnitude;
    private final Double qualityScore;
    private final Boolean validated;

    private RechargeEvent(Builder builder) {
        this.eventDate = Objects.requireNonNull(builder.eventDate, "eventDate must not be null");
        this.waterYear = builder.waterYear;
        this.season = builder.season != null ? builder.season : Season.of(builder.eventDate);
        this.observedLevel = builder.observedLevel;
        this.baselineLevel = builder.baselineLevel;
        this.deviation = builder.deviation;
        this.rechargeInches = builder.rechargeInches;
        this.magnitude = builder.magnitude != null ? builder.magnitude : EventMagnitude.classify(rechargeInches);
        this.qualityScore = builder.qualityScore;
        this.validated = builder.validated;
    }

    /**
     * Return a copy carrying a quality score and validation flag.
     *
     * @param score     quality score in [0, 1]
     * @param validated whether the event passed quality validation
     * @return new event
     */
    public RechargeEvent withQuality(double score, boolean validated) {
        return toBuilder().qualityScore(score).validated(validated).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .eventDate(eventDate)
                .waterYear(waterYear)
                .season(season)
                .observedLevel(observedLevel)
                .baselineLevel(baselineLevel)
                .deviation(deviation)
                .rechargeInches(rechargeInches)
                .magnitude(magnitude)
                .qualityScore(qualityScore)
                .validated(validated);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link RechargeEvent}. {@code eventDate} is required;
     * season and magnitude are derived when not given.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private LocalDateTime eventDate;
        private Integer waterYear;
        private Season season;
        private double observedLevel;
        private double baselineLevel;
        private double deviation;
        private double rechargeInches;
        private EventMagnitude magnitude;
        private Double qualityScore;
        private Boolean validated;

        public Builder eventDate(LocalDateTime eventDate) {
            this.eventDate = eventDate;
            return this;
        }

        public Builder waterYear(Integer waterYear) {
            this.waterYear = waterYear;
            return this;
        }

        public Builder season(Season season) {
            this.season = season;
            return this;
        }

        public Builder observedLevel(double observedLevel) {
            this.observedLevel = observedLevel;
            return this;
        }

        public Builder baselineLevel(double baselineLevel) {
            this.baselineLevel = baselineLevel;
            return this;
        }

        public Builder deviation(double deviation) {
            this.deviation = deviation;
            return this;
        }

        public Builder rechargeInches(double rechargeInches) {
            this.rechargeInches = rechargeInches;
            return this;
        }

        public Builder magnitude(EventMagnitude magnitude) {
            this.magnitude = magnitude;
            return this;
        }

        public Builder qualityScore(Double qualityScore) {
            this.qualityScore = qualityScore;
            return this;
        }

        public Builder validated(Boolean validated) {
            this.validated = validated;
            return this;
        }

        public RechargeEvent build() {
            return new RechargeEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public LocalDateTime getEventDate() {
        return eventDate;
    }

    public Integer getWaterYear() {
        return waterYear;
    }

    public Season getSeason() {
        return season;
    }

    public double getObservedLevel() {
        return observedLevel;
    }

    public double getBaselineLevel() {
        return baselineLevel;
    }

    /**
     * @return observed minus baseline level, in feet
     */
    public double getDeviation() {
        return deviation;
    }

    public double getRechargeInches() {
        return rechargeInches;
    }

    public EventMagnitude getMagnitude() {
        return magnitude;
    }

    public Double getQualityScore() {
        return qualityScore;
    }

    public Boolean getValidated() {
        return validated;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RechargeEvent that))
            return false;
        return Double.compare(observedLevel, that.observedLevel) == 0
                && Double.compare(baselineLevel, that.baselineLevel) == 0
                && Double.compare(deviation, that.deviation) == 0
                && Double.compare(rechargeInches, that.rechargeInches) == 0
                && eventDate.equals(that.eventDate)
                && Objects.equals(waterYear, that.waterYear)
                && season == that.season
                && magnitude == that.magnitude
                && Objects.equals(qualityScore, that.qualityScore)
                && Objects.equals(validated, that.validated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventDate, waterYear, deviation, rechargeInches);
    }

    @Override
    public String toString() {
        return "RechargeEvent{" +
                "eventDate=" + eventDate +
                ", waterYear=" + waterYear +
                ", deviation=" + deviation +
                ", rechargeInches=" + rechargeInches +
                ", magnitude=" + magnitude +
                (qualityScore != null ? ", qualityScore=" + qualityScore : "") +
                '}';
    }
}
