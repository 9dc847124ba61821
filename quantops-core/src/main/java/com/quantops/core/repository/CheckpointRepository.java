package com.quantops.core.repository;

import com.quantops.core.model.Checkpoint;

import java.util.Optional;

/**
 * Repository for checkpoint rows. One row per operation; artifacts live on the
 * filesystem and are referenced by path.
 */
public interface CheckpointRepository {

    /**
     * Insert or overwrite the checkpoint row of an operation.
     */
    void upsert(Checkpoint checkpoint);

    /**
     * Find the checkpoint row of an operation (without artifact blobs).
     */
    Optional<Checkpoint> findById(String operationId);

    /**
     * Delete the checkpoint row of an operation.
     *
     * @return true if a row was removed
     */
    boolean delete(String operationId);

    /**
     * Check whether an operation has a checkpoint row.
     */
    boolean exists(String operationId);
}
