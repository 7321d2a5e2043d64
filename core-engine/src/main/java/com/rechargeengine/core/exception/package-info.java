/**
 * Fatal error taxonomy of the recharge engine.
 *
 * <ul>
 * <li>{@link com.rechargeengine.core.exception.EmptySeriesException} - no
 * readings to work with</li>
 * <li>{@link com.rechargeengine.core.exception.InsufficientSegmentsException}
 * - fewer than three recession segments for curve fitting</li>
 * <li>{@link com.rechargeengine.core.exception.ValidationException} -
 * out-of-range parameters or malformed input</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.rechargeengine.core.exception;
