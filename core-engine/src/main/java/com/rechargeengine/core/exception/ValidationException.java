package com.rechargeengine.core.exception;

import java.util.Collections;
import java.util.List;

/**
 * Raised when calculation parameters or input data violate a precondition.
 *
 * <p>
 * Carries every problem found, not just the first one, so a caller can
 * correct a whole parameter set in one pass.
 * </p>
 *
 * @since 1.0.0
 */
public class ValidationException extends RechargeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public ValidationException(String error) {
        this(List.of(error));
    }

    public ValidationException(List<String> errors) {
        super("Invalid calculation input: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * @return unmodifiable list of individual validation messages
     */
    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }
}
