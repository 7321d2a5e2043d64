package com.rechargeengine.core.exception;

/**
 * Base type for every fatal condition raised by the recharge engine.
 *
 * <p>
 * All subclasses are unchecked: a fatal error aborts the current calculation
 * and propagates to the immediate caller. Quality problems (low R², weak
 * cross-validation, low event scores) are never reported through this
 * hierarchy; they are embedded in the successful result instead.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class RechargeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected RechargeException(String message) {
        super(message);
    }

    protected RechargeException(String message, Throwable cause) {
        super(message, cause);
    }
}
