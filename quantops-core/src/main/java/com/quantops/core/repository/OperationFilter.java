package com.quantops.core.repository;

import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationStatus;
import com.quantops.core.model.OperationType;

/**
 * Filters for listing operations. Null fields match everything.
 */
public record OperationFilter(
    OperationStatus status,
    OperationType operationType,
    String parentOperationId,
    int limit,
    int offset
) {
    public static final int DEFAULT_LIMIT = 100;

    public OperationFilter {
        limit = limit <= 0 ? DEFAULT_LIMIT : limit;
        offset = Math.max(0, offset);
    }

    public static OperationFilter all() {
        return new OperationFilter(null, null, null, DEFAULT_LIMIT, 0);
    }

    public boolean matches(Operation operation) {
        return (status == null || operation.status() == status)
            && (operationType == null || operation.operationType() == operationType)
            && (parentOperationId == null || parentOperationId.equals(operation.parentOperationId()));
    }
}
