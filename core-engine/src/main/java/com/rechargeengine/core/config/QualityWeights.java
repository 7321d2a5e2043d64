package com.rechargeengine.core.config;

import java.io.Serializable;
import java.util.Objects;

/**
 * Weights of the three event quality components used by the extended
 * recession curve method. The scorer normalizes by their sum, so only the
 * ratios matter.
 *
 * <pre>
 * qualityWeights:
 *   magnitude: 0.4
 *   crossValidation: 0.3
 *   seasonal: 0.3
 * </pre>
 *
 * @since 1.0.0
 */
public class QualityWeights implements Serializable {

    private static final long serialVersionUID = 1L;

    private double magnitude = 0.4;
    private double crossValidation = 0.3;
    private double seasonal = 0.3;

    public QualityWeights() {
    }

    public QualityWeights(double magnitude, double crossValidation, double seasonal) {
        this.magnitude = magnitude;
        this.crossValidation = crossValidation;
        this.seasonal = seasonal;
    }

    public QualityWeights copy() {
        return new QualityWeights(magnitude, crossValidation, seasonal);
    }

    /**
     * @return sum of the three weights
     */
    public double total() {
        return magnitude + crossValidation + seasonal;
    }

    public double getMagnitude() {
        return magnitude;
    }

    public void setMagnitude(double magnitude) {
        this.magnitude = magnitude;
    }

    public double getCrossValidation() {
        return crossValidation;
    }

    public void setCrossValidation(double crossValidation) {
        this.crossValidation = crossValidation;
    }

    public double getSeasonal() {
        return seasonal;
    }

    public void setSeasonal(double seasonal) {
        this.seasonal = seasonal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QualityWeights that))
            return false;
        return Double.compare(magnitude, that.magnitude) == 0
                && Double.compare(crossValidation, that.crossValidation) == 0
                && Double.compare(seasonal, that.seasonal) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(magnitude, crossValidation, seasonal);
    }

    @Override
    public String toString() {
        return "QualityWeights{magnitude=" + magnitude
                + ", crossValidation=" + crossValidation
                + ", seasonal=" + seasonal + '}';
    }
}
