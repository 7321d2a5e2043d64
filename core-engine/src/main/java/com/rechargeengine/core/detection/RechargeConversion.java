package com.rechargeengine.core.detection;

/**
 * Conversion of a water-level deviation to recharge depth.
 *
 * @since 1.0.0
 */
public final class RechargeConversion {

    public static final double INCHES_PER_FOOT = 12.0;

    private RechargeConversion() {
        // utility class
    }

    /**
     * {@code recharge = deviation * specificYield * 12}.
     *
     * @param deviationFeet level above baseline, in feet
     * @param specificYield specific yield of the aquifer
     * @return recharge in inches
     */
    public static double rechargeInches(double deviationFeet, double specificYield) {
        return deviationFeet * specificYield * INCHES_PER_FOOT;
    }
}
