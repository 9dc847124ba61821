package com.quantops.engine.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the operation being worked on.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forOperation(operationId, "TRAINING", parentId)) {
 *     log.info("Epoch complete"); // Automatically includes operationId, operationType
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [training-exec-1] INFO  c.q.w.WorkerRuntime - Epoch complete
 *   operationId=op_training_20240115_103000_1a2b3c4d operationType=TRAINING traceId=5e6f7a8b
 */
public final class LoggingContext implements AutoCloseable {

    public static final String OPERATION_ID = "operationId";
    public static final String OPERATION_TYPE = "operationType";
    public static final String PARENT_OPERATION_ID = "parentOperationId";
    public static final String WORKER_ID = "workerId";
    public static final String TRACE_ID = "traceId";

    // Values this scope replaced, restored on close; a null value means the key was absent
    private final Map<String, String> replaced = new LinkedHashMap<>();

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for an operation.
     */
    public static LoggingContext forOperation(String operationId) {
        return forOperation(operationId, null, null);
    }

    /**
     * Create a logging context for an operation, optionally a child of another.
     * A scope opened with no trace id in place starts a new one; nested scopes share it.
     */
    public static LoggingContext forOperation(String operationId, String operationType, String parentOperationId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(OPERATION_ID, operationId);
        ctx.put(OPERATION_TYPE, operationType);
        ctx.put(PARENT_OPERATION_ID, parentOperationId);
        ctx.startTraceIfAbsent();
        return ctx;
    }

    /**
     * Create a logging context for worker registry operations.
     */
    public static LoggingContext forWorker(String workerId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(WORKER_ID, workerId);
        ctx.startTraceIfAbsent();
        return ctx;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        replaced.put(key, MDC.get(key));
        MDC.put(key, value);
    }

    private void startTraceIfAbsent() {
        if (MDC.get(TRACE_ID) == null) {
            put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        replaced.forEach((key, previous) -> {
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        });
        replaced.clear();
    }
}
