package com.rechargeengine.core.model;

/**
 * Size class of a recharge event, by recharge depth in inches.
 *
 * @since 1.0.0
 */
public enum EventMagnitude {

    SMALL,
    MEDIUM,
    LARGE;

    private static final double MEDIUM_LOWER_BOUND = 0.1;
    private static final double LARGE_LOWER_BOUND = 0.5;

    /**
     * Classify a recharge depth.
     *
     * @param rechargeInches recharge in inches
     * @return {@code SMALL} below 0.1 in, {@code MEDIUM} below 0.5 in,
     *         otherwise {@code LARGE}
     */
    public static EventMagnitude classify(double rechargeInches) {
        if (rechargeInches < MEDIUM_LOWER_BOUND) {
            return SMALL;
        }
        return rechargeInches < LARGE_LOWER_BOUND ? MEDIUM : LARGE;
    }
}
