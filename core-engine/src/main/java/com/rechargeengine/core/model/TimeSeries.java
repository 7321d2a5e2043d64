package com.rechargeengine.core.model;

import com.rechargeengine.core.exception.EmptySeriesException;
import com.rechargeengine.core.exception.ValidationException;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, non-empty, immutable sequence of {@link Reading}s.
 *
 * <p>
 * Construction fails fast: an empty list raises
 * {@link EmptySeriesException}; timestamps that are not strictly increasing
 * (out of order or duplicated) raise {@link ValidationException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    static final double SECONDS_PER_DAY = 86_400.0;

    private final List<Reading> readings;

    public TimeSeries(List<Reading> readings) {
        Objects.requireNonNull(readings, "Readings must not be null");
        if (readings.isEmpty()) {
            throw new EmptySeriesException("Time series contains no readings");
        }
        List<Reading> copy = new ArrayList<>(readings.size());
        LocalDateTime previous = null;
        for (int i = 0; i < readings.size(); i++) {
            Reading reading = Objects.requireNonNull(readings.get(i), "Reading at index " + i + " is null");
            if (previous != null && !reading.getTimestamp().isAfter(previous)) {
                throw new ValidationException("Reading timestamps must be strictly increasing; index " + i
                        + " (" + reading.getTimestamp() + ") does not follow " + previous);
            }
            previous = reading.getTimestamp();
            copy.add(reading);
        }
        this.readings = Collections.unmodifiableList(copy);
    }

    /**
     * Fractional days elapsed between two instants.
     *
     * @param from start timestamp
     * @param to   end timestamp
     * @return days, negative when {@code to} precedes {@code from}
     */
    public static double daysBetween(LocalDateTime from, LocalDateTime to) {
        return ChronoUnit.SECONDS.between(from, to) / SECONDS_PER_DAY;
    }

    public List<Reading> getReadings() {
        return readings;
    }

    public int size() {
        return readings.size();
    }

    public Reading get(int index) {
        return readings.get(index);
    }

    public Reading first() {
        return readings.get(0);
    }

    public Reading last() {
        return readings.get(readings.size() - 1);
    }

    /**
     * @return days between the first and last reading
     */
    public double spanDays() {
        return daysBetween(first().getTimestamp(), last().getTimestamp());
    }

    /**
     * @return water levels in series order
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
        if (!(o instanceof TimeSeries that))
            return false;
        return readings.equals(that.readings);
    }

    @Override
    public int hashCode() {
        return readings.hashCode();
    }

    @Override
    public String toString() {
        return "TimeSeries{size=" + readings.size()
                + ", from=" + first().getTimestamp()
                + ", to=" + last().getTimestamp() + '}';
    }
}
