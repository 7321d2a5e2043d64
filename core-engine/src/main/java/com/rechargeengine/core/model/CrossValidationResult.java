package com.rechargeengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of cross-validating a master recession curve.
 *
 * <p>
 * Fold results are kept in fold order. {@code foldCurves[i]} is the curve
 * refitted on the training part of fold {@code i}; the event quality scorer
 * compares baselines from these curves against the full-data curve.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CrossValidationResult implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Drop in R² from full data to validation that flags a degraded fit. */
    public static final double DEGRADATION_MARGIN = 0.1;

    private final CrossValidationMethod method;
    private final List<Double> foldRSquared;
    private final double meanRSquared;
    private final double fullDataRSquared;
    private final List<MasterCurve> foldCurves;

    @JsonCreator
    public CrossValidationResult(@JsonProperty("method") CrossValidationMethod method,
            @JsonProperty("foldRSquared") List<Double> foldRSquared,
            @JsonProperty("meanRSquared") double meanRSquared,
            @JsonProperty("fullDataRSquared") double fullDataRSquared,
            @JsonProperty("foldCurves") List<MasterCurve> foldCurves) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.foldRSquared = List.copyOf(Objects.requireNonNull(foldRSquared, "foldRSquared must not be null"));
        this.meanRSquared = meanRSquared;
        this.fullDataRSquared = fullDataRSquared;
        this.foldCurves = foldCurves != null ? List.copyOf(foldCurves) : List.of();
    }

    public CrossValidationMethod getMethod() {
        return method;
    }

    public List<Double> getFoldRSquared() {
        return foldRSquared;
    }

    public double getMeanRSquared() {
        return meanRSquared;
    }

    public double getFullDataRSquared() {
        return fullDataRSquared;
    }

    public List<MasterCurve> getFoldCurves() {
        return foldCurves;
    }

    public int getFoldCount() {
        return foldRSquared.size();
    }

    /**
     * @return {@code true} when mean validation R² is more than
     *         {@value #DEGRADATION_MARGIN} below the full-data R²
     */
    public boolean isDegraded() {
        return meanRSquared < fullDataRSquared - DEGRADATION_MARGIN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CrossValidationResult that))
            return false;
        return Double.compare(meanRSquared, that.meanRSquared) == 0
                && Double.compare(fullDataRSquared, that.fullDataRSquared) == 0
                && method == that.method
                && foldRSquared.equals(that.foldRSquared)
                && foldCurves.equals(that.foldCurves);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, foldRSquared, meanRSquared, fullDataRSquared);
    }

    @Override
    public String toString() {
        return "CrossValidationResult{" +
                "method=" + method +
                ", folds=" + foldRSquared.size() +
                ", meanRSquared=" + meanRSquared +
                ", fullDataRSquared=" + fullDataRSquared +
                ", degraded=" + isDegraded() +
                '}';
    }
}
