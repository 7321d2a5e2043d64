package com.rechargeengine.core.model;

/**
 * Strategies for splitting recession segments into training and validation
 * sets.
 *
 * @since 1.0.0
 */
public enum CrossValidationMethod {

    /** Contiguous chronological blocks, optionally shuffled with a seed. */
    K_FOLD,

    /** Every segment is held out once. */
    LEAVE_ONE_OUT,

    /** Earliest segments train, the latest validate. */
    TEMPORAL_SPLIT
}
