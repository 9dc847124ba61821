package com.quantops.engine.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantops.core.model.Operation;
import com.quantops.core.model.WorkerRegistration;
import com.quantops.core.progress.MetricsPage;

import java.util.Optional;

/**
 * Transport from the orchestrator to a worker runtime.
 */
public interface WorkerGateway {

    /**
     * Check whether this gateway can reach the worker's endpoint.
     */
    boolean supports(WorkerRegistration worker);

    /**
     * Ask the worker to start an operation under the orchestrator's id.
     */
    void start(WorkerRegistration worker, Operation operation, JsonNode request);

    /**
     * Ask the worker to resume an operation from its checkpoint.
     */
    void resume(WorkerRegistration worker, String operationId);

    /**
     * Ask the worker to cancel an operation it is running.
     */
    void cancel(WorkerRegistration worker, String operationId, String reason);

    /**
     * Fetch the worker's view of an operation (status and latest progress).
     */
    Optional<Operation> fetchOperation(WorkerRegistration worker, String operationId);

    /**
     * Fetch metric records appended since {@code cursor}.
     */
    MetricsPage fetchMetrics(WorkerRegistration worker, String operationId, int cursor);
}
