package com.rechargeengine.core.model;

import java.time.LocalDateTime;
import java.time.Month;

/**
 * Meteorological seasons used for seasonal recession analysis.
 *
 * @since 1.0.0
 */
public enum Season {

    /** December, January, February. */
    WINTER,
    /** March, April, May. */
    SPRING,
    /** June, July, August. */
    SUMMER,
    /** September, October, November. */
    FALL;

    public static Season of(Month month) {
        return switch (month) {
            case DECEMBER, JANUARY, FEBRUARY -> WINTER;
            case MARCH, APRIL, MAY -> SPRING;
            case JUNE, JULY, AUGUST -> SUMMER;
            default -> FALL;
        };
    }

    public static Season of(LocalDateTime timestamp) {
        return of(timestamp.getMonth());
    }
}
