package com.parametric.error;

/**
 * Root of the settlement error taxonomy. Every subclass carries a stable,
 * machine-readable error code that the REST boundary exposes as {@code error_code}.
 */
public abstract class SettlementException extends RuntimeException {

    private final String errorCode;

    protected SettlementException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected SettlementException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
