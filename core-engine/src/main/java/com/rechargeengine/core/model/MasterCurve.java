package com.rechargeengine.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A fitted master recession curve.
 *
 * <p>
 * For single-curve families {@link #getParameters()} holds the fitted
 * parameters of {@link #getCurveType()}. A {@link CurveType#MULTI_SEGMENT}
 * curve instead carries one partition curve per season (or per period between
 * caller-supplied breakpoints) and keeps a pooled fit of
 * {@link #getBaseCurveType()} in {@link #getParameters()} as the fallback for
 * partitions that had too few segments of their own.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code curveType} and {@code parameters} are
 * required; a multi-segment curve also requires {@code baseCurveType}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = MasterCurve.Builder.class)
public final class MasterCurve implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Label prefix of partitions delimited by breakpoint dates. */
    public static final String PERIOD_LABEL_PREFIX = "period-";

    private final CurveType curveType;
    private final Map<String, Double> parameters;
    private final double rSquared;
    private final int segmentCount;
    private final int pointCount;
    private final Season season;
    private final String partitionLabel;
    private final CurveType baseCurveType;
    private final Map<String, MasterCurve> partitions;
    private final List<LocalDate> breakpoints;

    private MasterCurve(Builder builder) {
        this.curveType = Objects.requireNonNull(builder.curveType, "curveType must not be null");
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(builder.parameters, "parameters must not be null")));
        this.rSquared = builder.rSquared;
        this.segmentCount = builder.segmentCount;
        this.pointCount = builder.pointCount;
        this.season = builder.season;
        this.partitionLabel = builder.partitionLabel;
        if (curveType == CurveType.MULTI_SEGMENT) {
            this.baseCurveType = Objects.requireNonNull(builder.baseCurveType,
                    "baseCurveType must not be null for a multi-segment curve");
            if (baseCurveType == CurveType.MULTI_SEGMENT) {
                throw new IllegalArgumentException("A multi-segment curve cannot nest multi-segment curves");
            }
        } else {
            this.baseCurveType = builder.baseCurveType;
        }
        this.partitions = builder.partitions != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.partitions))
                : null;
        this.breakpoints = builder.breakpoints != null ? List.copyOf(builder.breakpoints) : null;
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate this curve {@code t} days after recession onset. A
     * multi-segment curve evaluates its pooled fallback fit.
     *
     * @param t days since onset
     * @return predicted level in feet
     */
    public double evaluate(double t) {
        return evaluationType().evaluate(parameters, t);
    }

    /**
     * @return the family whose formula {@link #evaluate(double)} applies
     */
    public CurveType evaluationType() {
        return curveType == CurveType.MULTI_SEGMENT ? baseCurveType : curveType;
    }

    /**
     * Select the curve that governs a recession starting at the given
     * timestamp: the matching partition of a multi-segment curve, the
     * fallback when that partition has no fit, or this curve itself.
     *
     * @param segmentStart start of the governing recession segment
     * @return curve to evaluate
     */
    public MasterCurve curveFor(LocalDateTime segmentStart) {
        if (curveType != CurveType.MULTI_SEGMENT || partitions == null) {
            return this;
        }
        MasterCurve partition = partitions.get(partitionLabelFor(segmentStart));
        return partition != null ? partition : this;
    }

    /**
     * Partition label of a segment start: {@code period-N} where N counts the
     * breakpoints on or before the date, or the season name when no
     * breakpoints were configured.
     *
     * @param segmentStart segment start timestamp
     * @return partition label
     */
    public String partitionLabelFor(LocalDateTime segmentStart) {
        return partitionLabel(segmentStart, breakpoints);
    }

    /**
     * Partition label for a timestamp under the given breakpoints.
     *
     * @param timestamp   segment start timestamp
     * @param breakpoints sorted breakpoint dates, or {@code null}/empty for
     *                    seasonal partitioning
     * @return partition label
     */
    public static String partitionLabel(LocalDateTime timestamp, List<LocalDate> breakpoints) {
        if (breakpoints == null || breakpoints.isEmpty()) {
            return Season.of(timestamp).name();
        }
        LocalDate date = timestamp.toLocalDate();
        int period = 0;
        for (LocalDate breakpoint : breakpoints) {
            if (!breakpoint.isAfter(date)) {
                period++;
            }
        }
        return PERIOD_LABEL_PREFIX + period;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link MasterCurve}; also used by Jackson.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private CurveType curveType;
        private Map<String, Double> parameters;
        private double rSquared;
        private int segmentCount;
        private int pointCount;
        private Season season;
        private String partitionLabel;
        private CurveType baseCurveType;
        private Map<String, MasterCurve> partitions;
        private List<LocalDate> breakpoints;

        public Builder curveType(CurveType curveType) {
            this.curveType = curveType;
            return this;
        }

        public Builder parameters(Map<String, Double> parameters) {
            this.parameters = parameters;
            return this;
        }

        @JsonProperty("rSquared")
        public Builder rSquared(double rSquared) {
            this.rSquared = rSquared;
            return this;
        }

        public Builder segmentCount(int segmentCount) {
            this.segmentCount = segmentCount;
            return this;
        }

        public Builder pointCount(int pointCount) {
            this.pointCount = pointCount;
            return this;
        }

        public Builder season(Season season) {
            this.season = season;
            return this;
        }

        public Builder partitionLabel(String partitionLabel) {
            this.partitionLabel = partitionLabel;
            return this;
        }

        public Builder baseCurveType(CurveType baseCurveType) {
            this.baseCurveType = baseCurveType;
            return this;
        }

        public Builder partitions(Map<String, MasterCurve> partitions) {
            this.partitions = partitions;
            return this;
        }

        public Builder breakpoints(List<LocalDate> breakpoints) {
            this.breakpoints = breakpoints;
            return this;
        }

        public MasterCurve build() {
            return new MasterCurve(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public CurveType getCurveType() {
        return curveType;
    }

    public Map<String, Double> getParameters() {
        return parameters;
    }

    /**
     * @return coefficient of determination in level space
     */
    @JsonProperty("rSquared")
    public double getRSquared() {
        return rSquared;
    }

    public int getSegmentCount() {
        return segmentCount;
    }

    public int getPointCount() {
        return pointCount;
    }

    /**
     * @return season of a seasonal partition curve, otherwise {@code null}
     */
    public Season getSeason() {
        return season;
    }

    public String getPartitionLabel() {
        return partitionLabel;
    }

    public CurveType getBaseCurveType() {
        return baseCurveType;
    }

    /**
     * @return partition curves keyed by label, or {@code null} for a single
     *         curve
     */
    public Map<String, MasterCurve> getPartitions() {
        return partitions;
    }

    public List<LocalDate> getBreakpoints() {
        return breakpoints;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MasterCurve that))
            return false;
        return Double.compare(rSquared, that.rSquared) == 0
                && segmentCount == that.segmentCount
                && pointCount == that.pointCount
                && curveType == that.curveType
                && parameters.equals(that.parameters)
                && season == that.season
                && Objects.equals(partitionLabel, that.partitionLabel)
                && baseCurveType == that.baseCurveType
                && Objects.equals(partitions, that.partitions)
                && Objects.equals(breakpoints, that.breakpoints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(curveType, parameters, rSquared, segmentCount, pointCount, partitionLabel);
    }

    @Override
    public String toString() {
        return "MasterCurve{" +
                "curveType=" + curveType +
                ", parameters=" + parameters +
                ", rSquared=" + rSquared +
                ", segmentCount=" + segmentCount +
                (partitionLabel != null ? ", partitionLabel='" + partitionLabel + '\'' : "") +
                (partitions != null ? ", partitions=" + partitions.keySet() : "") +
                '}';
    }
}
