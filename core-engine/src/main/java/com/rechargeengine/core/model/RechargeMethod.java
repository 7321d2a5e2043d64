package com.rechargeengine.core.model;

/**
 * Recharge estimation method.
 *
 * <ul>
 * <li>{@code RISE} - rise above an antecedent recession baseline</li>
 * <li>{@code MRC} - deviation from a master recession curve</li>
 * <li>{@code ERC} - MRC plus cross-validation, per-event quality and
 * seasonal analysis</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum RechargeMethod {
    RISE,
    MRC,
    ERC;

    /**
     * @return {@code true} when the method fits a master recession curve
     */
    public boolean usesRecessionCurve() {
        return this != RISE;
    }
}
