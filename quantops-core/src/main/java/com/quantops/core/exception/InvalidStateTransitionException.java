package com.quantops.core.exception;

import com.quantops.core.model.OperationStatus;

/**
 * Thrown when an illegal status transition is attempted.
 * Indicates a programming error rather than a race.
 */
public class InvalidStateTransitionException extends QuantOpsException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String operationId, OperationStatus current, OperationStatus target) {
        super(ERROR_CODE, String.format(
            "Cannot transition operation %s from %s to %s",
            operationId, current, target
        ));
    }
}
