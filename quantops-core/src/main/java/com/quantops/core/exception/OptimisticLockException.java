package com.quantops.core.exception;

/**
 * Thrown when an optimistic lock conflict occurs during update.
 */
public class OptimisticLockException extends QuantOpsException {

    public static final String ERROR_CODE = "OPTIMISTIC_LOCK_CONFLICT";

    public OptimisticLockException(String entityType, String entityId, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, String.format(
            "Optimistic lock conflict on %s[%s]: expected version %d, actual version %d",
            entityType, entityId, expectedVersion, actualVersion
        ));
    }

    public OptimisticLockException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s was modified concurrently: %s",
            entityType, entityId
        ));
    }
}
