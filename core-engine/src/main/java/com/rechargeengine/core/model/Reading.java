package com.rechargeengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single water-level observation.
 *
 * <p>
 * Levels are in feet. Precipitation is optional and only consulted by the
 * recession segment identifier. The water-year label is {@code null} until the
 * preprocessor assigns it.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Reading implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDateTime timestamp;
    private final double waterLevel;
    private final Double precipitation;
    private final Integer waterYear;

    public Reading(LocalDateTime timestamp, double waterLevel) {
        this(timestamp, waterLevel, null, null);
    }

    public Reading(LocalDateTime timestamp, double waterLevel, Double precipitation) {
        this(timestamp, waterLevel, precipitation, null);
    }

    @JsonCreator
    public Reading(@JsonProperty("timestamp") LocalDateTime timestamp,
            @JsonProperty("waterLevel") double waterLevel,
            @JsonProperty("precipitation") Double precipitation,
            @JsonProperty("waterYear") Integer waterYear) {
        this.timestamp = Objects.requireNonNull(timestamp, "Reading timestamp must not be null");
        this.waterLevel = waterLevel;
        this.precipitation = precipitation;
        this.waterYear = waterYear;
    }

    /**
     * Return a copy of this reading labelled with the given water year.
     *
     * @param year water year (named by the calendar year in which it ends)
     * @return new reading
     */
    public Reading withWaterYear(int year) {
        return new Reading(timestamp, waterLevel, precipitation, year);
    }

    /**
     * Return a copy of this reading with a different level.
     *
     * @param level new water level in feet
     * @return new reading
     */
    public Reading withWaterLevel(double level) {
        return new Reading(timestamp, level, precipitation, waterYear);
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public double getWaterLevel() {
        return waterLevel;
    }

    /**
     * @return precipitation recorded with this reading, or {@code null}
     */
    public Double getPrecipitation() {
        return precipitation;
    }

    /**
     * @return the water-year label, or {@code null} before preprocessing
     */
    public Integer getWaterYear() {
        return waterYear;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Reading that))
            return false;
        return Double.compare(waterLevel, that.waterLevel) == 0
                && timestamp.equals(that.timestamp)
                && Objects.equals(precipitation, that.precipitation)
                && Objects.equals(waterYear, that.waterYear);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, waterLevel, precipitation, waterYear);
    }

    @Override
    public String toString() {
        return "Reading{" +
                "timestamp=" + timestamp +
                ", waterLevel=" + waterLevel +
                (precipitation != null ? ", precipitation=" + precipitation : "") +
                (waterYear != null ? ", waterYear=" + waterYear : "") +
                '}';
    }
}
