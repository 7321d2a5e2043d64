package com.rechargeengine.core.exception;

/**
 * Raised when a time series has no readings, either as supplied or after
 * preprocessing removed every reading.
 *
 * @since 1.0.0
 */
public class EmptySeriesException extends RechargeException {

    private static final long serialVersionUID = 1L;

    public EmptySeriesException(String message) {
        super(message);
    }
}
