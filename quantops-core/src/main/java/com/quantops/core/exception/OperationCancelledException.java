package com.quantops.core.exception;

/**
 * Thrown inside an execution loop once its cancellation token is set.
 */
public class OperationCancelledException extends QuantOpsException {

    public static final String ERROR_CODE = "OPERATION_CANCELLED";

    private final String operationId;

    public OperationCancelledException(String operationId, String reason) {
        super(ERROR_CODE, String.format(
            "Operation %s cancelled: %s",
            operationId, reason
        ));
        this.operationId = operationId;
    }

    public String getOperationId() {
        return operationId;
    }
}
