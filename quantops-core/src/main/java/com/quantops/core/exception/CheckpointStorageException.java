package com.quantops.core.exception;

/**
 * Thrown when a checkpoint cannot be written, read or removed.
 */
public class CheckpointStorageException extends QuantOpsException {

    public static final String ERROR_CODE = "CHECKPOINT_STORAGE_FAILED";

    public CheckpointStorageException(String operationId, String message, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Checkpoint storage failed for %s: %s",
            operationId, message
        ), cause);
    }
}
