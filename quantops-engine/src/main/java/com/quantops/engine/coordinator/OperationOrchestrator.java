package com.quantops.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantops.core.exception.InvalidStateTransitionException;
import com.quantops.core.exception.NoWorkerAvailableException;
import com.quantops.core.exception.NotFoundException;
import com.quantops.core.exception.OperationConflictException;
import com.quantops.core.exception.QuantOpsException;
import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationStatus;
import com.quantops.core.model.OperationType;
import com.quantops.core.model.WorkerRegistration;
import com.quantops.core.progress.MetricsPage;
import com.quantops.engine.checkpoint.CheckpointService;
import com.quantops.engine.dispatch.WorkerGateway;
import com.quantops.engine.logging.LoggingContext;
import com.quantops.engine.registry.WorkerRegistry;
import com.quantops.engine.service.OperationsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Creates operations, dispatches them to workers, relays cancel and resume
 * requests, and mirrors the status of remotely running operations.
 */
public class OperationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(OperationOrchestrator.class);

    public static final String WORKER_ID = "worker_id";
    public static final String PARAMETERS = "parameters";

    private final OperationsService operations;
    private final WorkerRegistry workers;
    private final WorkerGateway gateway;
    private final CheckpointService checkpoints;
    private final ObjectMapper objectMapper;

    public OperationOrchestrator(
            OperationsService operations,
            WorkerRegistry workers,
            WorkerGateway gateway,
            CheckpointService checkpoints,
            ObjectMapper objectMapper) {
        this.operations = operations;
        this.workers = workers;
        this.gateway = gateway;
        this.checkpoints = checkpoints;
        this.objectMapper = objectMapper;
    }

    /**
     * Create a PENDING operation and dispatch it to an idle worker of its type.
     *
     * @throws NoWorkerAvailableException if no worker can take it; the operation is left FAILED
     */
    public Operation createAndStart(OperationType type, JsonNode request, String parentOperationId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(PARAMETERS, objectMapper.convertValue(
            request != null ? request : objectMapper.createObjectNode(), Map.class));

        Operation operation = operations.create(type, metadata, parentOperationId);
        String operationId = operation.operationId();

        try (var ctx = LoggingContext.forOperation(operationId, type.name(), parentOperationId)) {
            WorkerRegistration worker = workers.selectAndMarkBusy(type, operationId).orElse(null);
            if (worker == null) {
                NoWorkerAvailableException error = new NoWorkerAvailableException(type);
                operations.fail(operationId, error.getMessage());
                throw error;
            }

            operations.updateMetadata(operationId, Map.of(WORKER_ID, worker.workerId()));
            try {
                gateway.start(worker, operation, request);
            } catch (QuantOpsException e) {
                workers.releaseOperation(operationId);
                failIfActive(operationId, "Dispatch failed: " + e.getMessage());
                throw e;
            }
            log.info("Started {} operation {} on worker {}", type, operationId, worker.workerId());
            return operations.get(operationId);
        }
    }

    /**
     * Cancel an operation here and on the worker running it.
     *
     * @throws OperationConflictException if the operation already finished
     */
    public Operation cancel(String operationId, String reason) {
        Operation current = operations.get(operationId);
        if (!current.status().isCancellable()) {
            throw new OperationConflictException(operationId, current.status(), "cancel");
        }

        Optional<WorkerRegistration> worker = workers.findByOperation(operationId);
        if (worker.isPresent() && !operations.hasLocalExecution(operationId)) {
            try {
                gateway.cancel(worker.get(), operationId, reason);
            } catch (QuantOpsException e) {
                log.warn("Worker {} did not acknowledge cancel of {}: {}",
                    worker.get().workerId(), operationId, e.getMessage());
            }
        }

        Operation cancelled;
        try {
            cancelled = operations.cancel(operationId, reason);
        } catch (OperationConflictException e) {
            // The worker finished first; report its terminal status
            cancelled = operations.get(operationId);
            if (cancelled.status() != OperationStatus.CANCELLED) {
                throw e;
            }
        }
        if (!operations.hasLocalExecution(operationId)) {
            workers.releaseOperation(operationId);
        }
        return cancelled;
    }

    /**
     * Resume a CANCELLED or FAILED operation from its checkpoint.
     *
     * @throws NotFoundException if the operation or its checkpoint is missing
     * @throws OperationConflictException if the operation is not resumable or another caller won
     */
    public Operation resume(String operationId) {
        Operation current = operations.get(operationId);
        if (!checkpoints.exists(operationId)) {
            throw new NotFoundException("Checkpoint", operationId);
        }
        if (!operations.tryResume(operationId)) {
            throw new OperationConflictException(operationId, operations.get(operationId).status(), "resume");
        }

        try (var ctx = LoggingContext.forOperation(operationId, current.operationType().name(),
                current.parentOperationId())) {
            WorkerRegistration worker = workers.selectAndMarkBusy(current.operationType(), operationId)
                .orElse(null);
            if (worker == null) {
                NoWorkerAvailableException error = new NoWorkerAvailableException(current.operationType());
                operations.fail(operationId, "Resume failed: " + error.getMessage());
                throw error;
            }

            operations.updateMetadata(operationId, Map.of(WORKER_ID, worker.workerId()));
            try {
                gateway.resume(worker, operationId);
            } catch (QuantOpsException e) {
                workers.releaseOperation(operationId);
                failIfActive(operationId, "Resume dispatch failed: " + e.getMessage());
                throw e;
            }
            log.info("Resumed operation {} on worker {}", operationId, worker.workerId());
            return operations.get(operationId);
        }
    }

    /**
     * Pull the worker's view of a remotely running operation and mirror its
     * progress and terminal status locally.
     */
    public Operation refresh(String operationId) {
        Operation current = operations.get(operationId);
        if (!current.status().isActive() || operations.hasLocalExecution(operationId)) {
            return current;
        }
        Optional<WorkerRegistration> worker = workers.findByOperation(operationId);
        if (worker.isEmpty() || worker.get().isInProcess()) {
            return current;
        }

        Optional<Operation> remote;
        try {
            remote = gateway.fetchOperation(worker.get(), operationId);
        } catch (QuantOpsException e) {
            log.debug("Could not refresh {} from worker {}: {}", operationId, worker.get().workerId(), e.getMessage());
            return current;
        }
        if (remote.isEmpty()) {
            return current;
        }
        return mirror(current, remote.get());
    }

    /**
     * Metric records since {@code cursor}, read locally or from the owning worker.
     */
    public MetricsPage metrics(String operationId, int cursor) {
        if (operations.hasLocalExecution(operationId)) {
            return operations.metrics(operationId, cursor);
        }
        Optional<WorkerRegistration> worker = workers.findByOperation(operationId);
        if (worker.isPresent() && !worker.get().isInProcess()) {
            return gateway.fetchMetrics(worker.get(), operationId, cursor);
        }
        return operations.metrics(operationId, cursor);
    }

    /**
     * Free the worker that ran a finished operation.
     */
    public void onOperationFinished(String operationId) {
        workers.releaseOperation(operationId);
    }

    // ========== Helper Methods ==========

    /**
     * Apply a remote snapshot. Safe to run concurrently: a refresh that loses
     * the race to another refresh returns the status the winner stored.
     */
    private Operation mirror(Operation current, Operation remote) {
        String operationId = current.operationId();
        try {
            Operation stored = operations.get(operationId);
            if (stored.status().isTerminal()) {
                return stored;
            }
            Operation updated = operations.updateProgress(operationId, remote.progress());
            boolean remoteStarted = remote.status() == OperationStatus.RUNNING
                || remote.status() == OperationStatus.COMPLETED;
            if (remoteStarted && updated.status() != OperationStatus.RUNNING) {
                updated = operations.start(operationId);
            }

            switch (remote.status()) {
                case COMPLETED -> updated = operations.complete(operationId, remote.resultSummary());
                case FAILED -> updated = operations.fail(operationId, remote.errorMessage());
                case CANCELLED -> updated = operations.cancel(operationId,
                    remote.metadataString(OperationRegistry.CANCELLATION_REASON));
                default -> {
                    return updated;
                }
            }
            onOperationFinished(operationId);
            return updated;

        } catch (InvalidStateTransitionException | OperationConflictException e) {
            Operation stored = operations.get(operationId);
            log.debug("Remote status {} of {} already applied, stored status {}",
                remote.status(), operationId, stored.status());
            return stored;
        }
    }

    private void failIfActive(String operationId, String message) {
        Operation current = operations.get(operationId);
        if (current.status().isActive()) {
            operations.fail(operationId, message);
        }
    }
}
