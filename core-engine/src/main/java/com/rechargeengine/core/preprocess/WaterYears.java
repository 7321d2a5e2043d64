package com.rechargeengine.core.preprocess;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.MonthDay;
import java.util.Objects;

/**
 * Water-year arithmetic.
 *
 * <p>
 * A water year is named by the calendar year in which it ends. With the usual
 * October 1 start, readings from Oct 1 of year Y through Sep 30 of year Y+1
 * belong to water year Y+1. With a January 1 start the water year is the
 * calendar year.
 * </p>
 *
 * @since 1.0.0
 */
public final class WaterYears {

    private static final MonthDay JANUARY_FIRST = MonthDay.of(1, 1);

    private WaterYears() {
        // utility class
    }

    /**
     * @param timestamp reading timestamp
     * @param start     first day of the water year
     * @return water-year label of the timestamp
     */
    public static int of(LocalDateTime timestamp, MonthDay start) {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(start, "water-year start must not be null");
        LocalDate date = timestamp.toLocalDate();
        int startYear = date.isBefore(start.atYear(date.getYear()))
                ? date.getYear() - 1
                : date.getYear();
        return start.equals(JANUARY_FIRST) ? startYear : startYear + 1;
    }

    /**
     * @param waterYear water-year label
     * @param start     first day of the water year
     * @return first calendar date of that water year
     */
    public static LocalDate firstDay(int waterYear, MonthDay start) {
        int startYear = start.equals(JANUARY_FIRST) ? waterYear : waterYear - 1;
        return start.atYear(startYear);
    }
}
