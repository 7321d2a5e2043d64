package com.rechargeengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Recharge totals for one season across all water years.
 *
 * @since 1.0.0
 */
public final class SeasonalSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Season season;
    private final int eventCount;
    private final double totalRecharge;
    private final double averageDeviation;

    @JsonCreator
    public SeasonalSummary(@JsonProperty("season") Season season,
            @JsonProperty("eventCount") int eventCount,
            @JsonProperty("totalRecharge") double totalRecharge,
            @JsonProperty("averageDeviation") double averageDeviation) {
        this.season = Objects.requireNonNull(season, "season must not be null");
        this.eventCount = eventCount;
        this.totalRecharge = totalRecharge;
        this.averageDeviation = averageDeviation;
    }

    public Season getSeason() {
        return season;
    }

    public int getEventCount() {
        return eventCount;
    }

    public double getTotalRecharge() {
        return totalRecharge;
    }

    public double getAverageDeviation() {
        return averageDeviation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeasonalSummary that))
            return false;
        return season == that.season
                && eventCount == that.eventCount
                && Double.compare(totalRecharge, that.totalRecharge) == 0
                && Double.compare(averageDeviation, that.averageDeviation) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(season, eventCount, totalRecharge, averageDeviation);
    }

    @Override
    public String toString() {
        return "SeasonalSummary{season=" + season + ", eventCount=" + eventCount
                + ", totalRecharge=" + totalRecharge + '}';
    }
}
