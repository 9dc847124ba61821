package com.quantops.core.repository;

import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for Operation persistence.
 * Supports optimistic locking via the operation version.
 */
public interface OperationRepository {

    /**
     * Save a new operation.
     *
     * @param operation The operation to save
     * @throws OperationConflictException if an operation with the same id exists
     */
    void save(Operation operation);

    /**
     * Update an existing operation with optimistic locking.
     * The stored version must equal {@code operation.version() - 1}.
     *
     * @param operation The operation to update
     * @throws OptimisticLockException if the stored version doesn't match
     */
    void update(Operation operation);

    /**
     * Find an operation by ID.
     */
    Optional<Operation> findById(String operationId);

    /**
     * Find operations matching a filter, newest first.
     */
    List<Operation> find(OperationFilter filter);

    /**
     * Count operations matching a filter, ignoring limit and offset.
     */
    long count(OperationFilter filter);

    /**
     * Count operations in PENDING, RUNNING or RESUMING.
     */
    long countActive();

    /**
     * Find the children of a parent operation in creation order.
     */
    List<Operation> findByParent(String parentOperationId);

    /**
     * Find operations in a given status, oldest first.
     *
     * @param status The status
     * @param limit Maximum number of results
     */
    List<Operation> findByStatus(OperationStatus status, int limit);

    /**
     * Count operations per status.
     */
    Map<OperationStatus, Long> countByStatus();

    /**
     * Atomically move an operation from CANCELLED or FAILED to RESUMING.
     * Implemented as a single conditional write so that exactly one of any
     * number of concurrent callers observes {@code true}.
     *
     * @param operationId The operation to resume
     * @param resumedAt New start timestamp
     * @return true if this caller won the transition
     */
    boolean tryResume(String operationId, Instant resumedAt);

    /**
     * Find terminal operations completed before the given time, oldest first.
     * Used for retention.
     *
     * @param completedBefore Cutoff time
     * @param limit Maximum number of results
     */
    List<Operation> findFinishedBefore(Instant completedBefore, int limit);

    /**
     * Delete an operation row.
     *
     * @return true if a row was removed
     */
    boolean delete(String operationId);
}
