package com.quantops.core.exception;

import com.quantops.core.model.OperationStatus;

/**
 * Thrown when a request conflicts with the operation's current status:
 * cancelling a finished operation, resuming one that is not resumable,
 * or losing a concurrent resume race.
 */
public class OperationConflictException extends QuantOpsException {

    public static final String ERROR_CODE = "OPERATION_CONFLICT";

    private final OperationStatus currentStatus;

    public OperationConflictException(String operationId, OperationStatus currentStatus, String action) {
        super(ERROR_CODE, String.format(
            "Cannot %s operation %s in status %s",
            action, operationId, currentStatus
        ));
        this.currentStatus = currentStatus;
    }

    public OperationConflictException(String message) {
        super(ERROR_CODE, message);
        this.currentStatus = null;
    }

    public OperationStatus getCurrentStatus() {
        return currentStatus;
    }
}
