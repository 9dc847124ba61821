package com.quantops.core.exception;

/**
 * Thrown when a worker cannot be reached or rejects a dispatched request.
 */
public class WorkerDispatchException extends QuantOpsException {

    public static final String ERROR_CODE = "WORKER_DISPATCH_FAILED";

    public WorkerDispatchException(String workerId, String message) {
        super(ERROR_CODE, String.format(
            "Worker %s: %s",
            workerId, message
        ));
    }

    public WorkerDispatchException(String workerId, String message, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Worker %s: %s",
            workerId, message
        ), cause);
    }
}
