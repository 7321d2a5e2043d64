package com.rechargeengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Recharge totals for one water year.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class YearlySummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int waterYear;
    private final double totalRecharge;
    private final int eventCount;
    private final double maxDeviation;
    private final double avgDeviation;
    private final double annualRate;
    private final Double averageQualityScore;

    @JsonCreator
    public YearlySummary(@JsonProperty("waterYear") int waterYear,
            @JsonProperty("totalRecharge") double totalRecharge,
            @JsonProperty("eventCount") int eventCount,
            @JsonProperty("maxDeviation") double maxDeviation,
            @JsonProperty("avgDeviation") double avgDeviation,
            @JsonProperty("annualRate") double annualRate,
            @JsonProperty("averageQualityScore") Double averageQualityScore) {
        this.waterYear = waterYear;
        this.totalRecharge = totalRecharge;
        this.eventCount = eventCount;
        this.maxDeviation = maxDeviation;
        this.avgDeviation = avgDeviation;
        this.annualRate = annualRate;
        this.averageQualityScore = averageQualityScore;
    }

    public int getWaterYear() {
        return waterYear;
    }

    /**
     * @return summed recharge in inches
     */
    public double getTotalRecharge() {
        return totalRecharge;
    }

    public int getEventCount() {
        return eventCount;
    }

    public double getMaxDeviation() {
        return maxDeviation;
    }

    public double getAvgDeviation() {
        return avgDeviation;
    }

    /**
     * @return recharge scaled to inches per year over the span of the year's
     *         events
     */
    public double getAnnualRate() {
        return annualRate;
    }

    public Double getAverageQualityScore() {
        return averageQualityScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof YearlySummary that))
            return false;
        return waterYear == that.waterYear
                && eventCount == that.eventCount
                && Double.compare(totalRecharge, that.totalRecharge) == 0
                && Double.compare(maxDeviation, that.maxDeviation) == 0
                && Double.compare(avgDeviation, that.avgDeviation) == 0
                && Double.compare(annualRate, that.annualRate) == 0
                && Objects.equals(averageQualityScore, that.averageQualityScore);
    }

    @Override
    public int hashCode() {
        return Objects.hash(waterYear, totalRecharge, eventCount);
    }

    @Override
    public String toString() {
        return "YearlySummary{" +
                "waterYear=" + waterYear +
                ", totalRecharge=" + totalRecharge +
                ", eventCount=" + eventCount +
                ", annualRate=" + annualRate +
                '}';
    }
}
