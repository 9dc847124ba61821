package com.quantops.core.exception;

/**
 * Thrown when an operation, checkpoint or worker is not found.
 */
public class NotFoundException extends QuantOpsException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
