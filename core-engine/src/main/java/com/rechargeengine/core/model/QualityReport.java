package com.rechargeengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Overall quality indicators of a calculation.
 *
 * <p>
 * Any component that does not apply to the method is {@code null}: the rise
 * method has no curve and therefore no overall score, and only the extended
 * recession curve method reports cross-validation and event quality.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class QualityReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Double curveRSquared;
    private final Double meanCrossValidationRSquared;
    private final Double averageEventQuality;
    private final boolean crossValidationDegraded;
    private final Double overallScore;

    @JsonCreator
    public QualityReport(@JsonProperty("curveRSquared") Double curveRSquared,
            @JsonProperty("meanCrossValidationRSquared") Double meanCrossValidationRSquared,
            @JsonProperty("averageEventQuality") Double averageEventQuality,
            @JsonProperty("crossValidationDegraded") boolean crossValidationDegraded,
            @JsonProperty("overallScore") Double overallScore) {
        this.curveRSquared = curveRSquared;
        this.meanCrossValidationRSquared = meanCrossValidationRSquared;
        this.averageEventQuality = averageEventQuality;
        this.crossValidationDegraded = crossValidationDegraded;
        this.overallScore = overallScore;
    }

    public Double getCurveRSquared() {
        return curveRSquared;
    }

    public Double getMeanCrossValidationRSquared() {
        return meanCrossValidationRSquared;
    }

    public Double getAverageEventQuality() {
        return averageEventQuality;
    }

    public boolean isCrossValidationDegraded() {
        return crossValidationDegraded;
    }

    /**
     * @return overall score in [0, 1], or {@code null} when no curve was fitted
     */
    public Double getOverallScore() {
        return overallScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QualityReport that))
            return false;
        return crossValidationDegraded == that.crossValidationDegraded
                && Objects.equals(curveRSquared, that.curveRSquared)
                && Objects.equals(meanCrossValidationRSquared, that.meanCrossValidationRSquared)
                && Objects.equals(averageEventQuality, that.averageEventQuality)
                && Objects.equals(overallScore, that.overallScore);
    }

    @Override
    public int hashCode() {
        return Objects.hash(curveRSquared, meanCrossValidationRSquared, averageEventQuality,
                crossValidationDegraded, overallScore);
    }

    @Override
    public String toString() {
        return "QualityReport{" +
                "curveRSquared=" + curveRSquared +
                ", meanCrossValidationRSquared=" + meanCrossValidationRSquared +
                ", averageEventQuality=" + averageEventQuality +
                ", overallScore=" + overallScore +
                '}';
    }
}
