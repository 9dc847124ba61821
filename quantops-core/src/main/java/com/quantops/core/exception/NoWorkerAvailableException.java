package com.quantops.core.exception;

import com.quantops.core.model.OperationType;

/**
 * Thrown when no idle worker of the required type is registered.
 */
public class NoWorkerAvailableException extends QuantOpsException {

    public static final String ERROR_CODE = "NO_WORKER_AVAILABLE";

    public NoWorkerAvailableException(OperationType workerType) {
        super(ERROR_CODE, String.format(
            "No available worker of type %s",
            workerType
        ));
    }
}
