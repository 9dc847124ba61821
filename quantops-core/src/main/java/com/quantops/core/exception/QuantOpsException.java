package com.quantops.core.exception;

/**
 * Base exception for all operation orchestration errors.
 */
public class QuantOpsException extends RuntimeException {

    private final String errorCode;

    public QuantOpsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public QuantOpsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
