/**
 * Pipeline orchestration, result assembly and JSON serialization.
 *
 * <p>
 * Start at {@link com.rechargeengine.core.engine.RechargeEngine}.
 * </p>
 *
 * @since 1.0.0
 */
package com.rechargeengine.core.engine;
