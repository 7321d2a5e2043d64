/**
 * Water-year and seasonal recharge totals.
 *
 * @since 1.0.0
 */
package com.rechargeengine.core.aggregation;
