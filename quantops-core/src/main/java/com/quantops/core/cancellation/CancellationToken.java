package com.quantops.core.cancellation;

import com.quantops.core.exception.OperationCancelledException;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared between the registry and an execution loop.
 * The loop polls it at unit boundaries; nothing interrupts the loop mid-unit.
 */
public class CancellationToken {

    public static final String SHUTDOWN_REASON = "Worker shutdown";

    private final String operationId;
    private final AtomicReference<Request> request = new AtomicReference<>();

    public CancellationToken(String operationId) {
        this.operationId = operationId;
    }

    public String operationId() {
        return operationId;
    }

    /**
     * Request cancellation. Only the first request is kept.
     *
     * @return true if this call set the flag
     */
    public boolean cancel(String reason) {
        return request.compareAndSet(null, new Request(reason, false));
    }

    /**
     * Request cancellation because the hosting process is shutting down.
     */
    public boolean cancelForShutdown() {
        return request.compareAndSet(null, new Request(SHUTDOWN_REASON, true));
    }

    public boolean isCancelled() {
        return request.get() != null;
    }

    public boolean isShutdown() {
        Request current = request.get();
        return current != null && current.shutdown();
    }

    public String reason() {
        Request current = request.get();
        return current != null ? current.reason() : null;
    }

    /**
     * Throw {@link OperationCancelledException} if cancellation was requested.
     */
    public void throwIfCancelled() {
        Request current = request.get();
        if (current != null) {
            throw new OperationCancelledException(operationId, current.reason());
        }
    }

    private record Request(String reason, boolean shutdown) {
    }
}
