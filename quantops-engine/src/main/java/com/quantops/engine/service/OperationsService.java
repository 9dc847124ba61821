package com.quantops.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantops.core.cancellation.CancellationToken;
import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationProgress;
import com.quantops.core.model.OperationType;
import com.quantops.core.progress.MetricsPage;
import com.quantops.core.progress.ProgressBridge;
import com.quantops.core.repository.OperationFilter;
import com.quantops.core.repository.OperationPage;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source of truth for operation status.
 * Every status change goes through this service; illegal transitions raise
 * {@link com.quantops.core.exception.InvalidStateTransitionException}.
 */
public interface OperationsService {

    /**
     * Record a new PENDING operation with a generated id.
     */
    Operation create(OperationType type, Map<String, Object> metadata, String parentOperationId);

    /**
     * Record a new PENDING operation with a caller-supplied id.
     *
     * @throws com.quantops.core.exception.OperationConflictException if the id is taken
     */
    Operation create(String operationId, OperationType type, Map<String, Object> metadata, String parentOperationId);

    /**
     * Record an operation unknown to this process directly in RESUMING,
     * e.g. a worker that restarted before being asked to resume.
     */
    Operation adopt(String operationId, OperationType type, Map<String, Object> metadata);

    /**
     * PENDING or RESUMING -> RUNNING.
     */
    Operation start(String operationId);

    /**
     * Overwrite the progress snapshot. Never changes status.
     */
    Operation updateProgress(String operationId, OperationProgress progress);

    /**
     * Merge metadata entries into the operation.
     */
    Operation updateMetadata(String operationId, Map<String, Object> entries);

    /**
     * RUNNING -> COMPLETED. Deletes the operation's checkpoint before returning.
     */
    Operation complete(String operationId, JsonNode resultSummary);

    /**
     * PENDING, RUNNING or RESUMING -> FAILED. The checkpoint is preserved.
     */
    Operation fail(String operationId, String errorMessage);

    /**
     * PENDING, RUNNING or RESUMING -> CANCELLED. The checkpoint is preserved and
     * the registered cancellation token, if any, is flipped.
     *
     * @throws com.quantops.core.exception.OperationConflictException if already finished
     */
    Operation cancel(String operationId, String reason);

    /**
     * Atomically move CANCELLED or FAILED -> RESUMING.
     *
     * @return true for exactly one of any number of concurrent callers
     * @throws com.quantops.core.exception.NotFoundException if the operation is unknown
     */
    boolean tryResume(String operationId);

    /**
     * Get an operation, refreshing its progress from a registered local bridge.
     *
     * @throws com.quantops.core.exception.NotFoundException if the operation is unknown
     */
    Operation get(String operationId);

    Optional<Operation> find(String operationId);

    /**
     * List operations matching a filter, newest first, with totals.
     */
    OperationPage list(OperationFilter filter);

    /**
     * Children of a parent operation in creation order.
     */
    List<Operation> children(String parentOperationId);

    /**
     * Phase-weighted progress of a parent computed from its latest child.
     */
    OperationProgress aggregateChildProgress(String parentOperationId);

    /**
     * Metric records appended since {@code cursor} on a locally running operation.
     */
    MetricsPage metrics(String operationId, int cursor);

    void registerBridge(String operationId, ProgressBridge bridge);

    void registerCancellationToken(String operationId, CancellationToken token);

    /**
     * Drop the bridge and token of a finished local run, after a final progress refresh.
     */
    void release(String operationId);

    /**
     * Check whether the operation is executing in this process.
     */
    boolean hasLocalExecution(String operationId);

    /**
     * Delete terminal operations (and their checkpoints) completed before the cutoff.
     *
     * @return Number of purged operations
     */
    int purgeFinishedBefore(Instant cutoff);
}
