/**
 * Domain model of the recharge engine.
 *
 * <p>
 * Inputs ({@link com.rechargeengine.core.model.Reading},
 * {@link com.rechargeengine.core.model.TimeSeries}) and every intermediate
 * and final product of a calculation are immutable and JSON round-trippable.
 * The top-level output is
 * {@link com.rechargeengine.core.model.CalculationResult}.
 * </p>
 *
 * @since 1.0.0
 */
package com.rechargeengine.core.model;
