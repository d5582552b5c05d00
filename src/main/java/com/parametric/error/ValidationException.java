package com.parametric.error;

/**
 * Malformed input: missing fields, unknown operators, non-positive amounts.
 */
public class ValidationException extends SettlementException {

    public ValidationException(String message) {
        super("VALIDATION_FAILED", message);
    }
}
