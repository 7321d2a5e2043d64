package com.rechargeengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A contiguous span of readings during which the water level declines within
 * tolerance and no significant precipitation interferes.
 *
 * <p>
 * {@code lengthDays} counts the calendar days touched by the segment,
 * inclusive of both ends, so ten consecutive daily readings form a ten-day
 * segment. Derived values (length, net change, rate, season) are computed
 * from the readings and are not stored independently.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RecessionSegment implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<Reading> readings;
    private final double qualityScore;

    @JsonCreator
    public RecessionSegment(@JsonProperty("readings") List<Reading> readings,
            @JsonProperty("qualityScore") double qualityScore) {
        Objects.requireNonNull(readings, "Segment readings must not be null");
        if (readings.size() < 2) {
            throw new IllegalArgumentException("A recession segment needs at least 2 readings, got: "
                    + readings.size());
        }
        this.readings = List.copyOf(readings);
        this.qualityScore = qualityScore;
    }

    /**
     * @param score quality score in [0, 1]
     * @return a copy of this segment carrying the given quality score
     */
    public RecessionSegment withQualityScore(double score) {
        return new RecessionSegment(readings, score);
    }

    public List<Reading> getReadings() {
        return Collections.unmodifiableList(readings);
    }

    public LocalDateTime getStartTimestamp() {
        return readings.get(0).getTimestamp();
    }

    public LocalDateTime getEndTimestamp() {
        return readings.get(readings.size() - 1).getTimestamp();
    }

    public int getLengthDays() {
        return (int) ChronoUnit.DAYS.between(getStartTimestamp().toLocalDate(),
                getEndTimestamp().toLocalDate()) + 1;
    }

    public int getReadingCount() {
        return readings.size();
    }

    public double getStartLevel() {
        return readings.get(0).getWaterLevel();
    }

    public double getEndLevel() {
        return readings.get(readings.size() - 1).getWaterLevel();
    }

    /**
     * @return end level minus start level (negative for a recession)
     */
    public double getNetChange() {
        return getEndLevel() - getStartLevel();
    }

    /**
     * @return mean level change per elapsed day (ft/day)
     */
    public double getRecessionRate() {
        double elapsed = TimeSeries.daysBetween(getStartTimestamp(), getEndTimestamp());
        return elapsed > 0 ? getNetChange() / elapsed : 0.0;
    }

    public Season getSeason() {
        return Season.of(getStartTimestamp());
    }

    public double getQualityScore() {
        return qualityScore;
    }

    /**
     * @return days since the segment start for every reading
     */
    public double[] elapsedDays() {
        double[] t = new double[readings.size()];
        LocalDateTime start = getStartTimestamp();
        for (int i = 0; i < t.length; i++) {
            t[i] = TimeSeries.daysBetween(start, readings.get(i).getTimestamp());
        }
        return t;
    }

    /**
     * @return water levels of the segment readings
     */
    public double[] levels() {
        double[] levels = new double[readings.size()];
        for (int i = 0; i < levels.length; i++) {
            levels[i] = readings.get(i).getWaterLevel();
        }
        return levels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RecessionSegment that))
            return false;
        return Double.compare(qualityScore, that.qualityScore) == 0 && readings.equals(that.readings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(readings, qualityScore);
    }

    @Override
    public String toString() {
        return "RecessionSegment{" +
                "start=" + getStartTimestamp() +
                ", end=" + getEndTimestamp() +
                ", lengthDays=" + getLengthDays() +
                ", netChange=" + getNetChange() +
                ", qualityScore=" + qualityScore +
                '}';
    }
}
