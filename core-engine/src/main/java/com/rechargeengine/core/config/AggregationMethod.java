package com.rechargeengine.core.config;

/**
 * How the water levels falling into one resampling bucket are combined.
 *
 * @since 1.0.0
 */
public enum AggregationMethod {
    MEAN,
    MEDIAN,
    LAST
}
