package com.quantops.engine.persistence;

import com.quantops.core.model.Checkpoint;
import com.quantops.core.repository.CheckpointRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of CheckpointRepository.
 */
public class InMemoryCheckpointRepository implements CheckpointRepository {

    private final Map<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void upsert(Checkpoint checkpoint) {
        // Blobs live on disk; rows never carry them
        checkpoints.put(checkpoint.operationId(), checkpoint.withArtifacts(Map.of()));
    }

    @Override
    public Optional<Checkpoint> findById(String operationId) {
        return Optional.ofNullable(checkpoints.get(operationId));
    }

    @Override
    public boolean delete(String operationId) {
        return checkpoints.remove(operationId) != null;
    }

    @Override
    public boolean exists(String operationId) {
        return checkpoints.containsKey(operationId);
    }
}
