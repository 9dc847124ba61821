package com.quantops.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single saved restart point of an operation. Overwritten on every save.
 *
 * Primary Key: operationId
 *
 * {@code artifacts} is only populated when a checkpoint is loaded with its
 * binary blobs; rows read from the repository carry an empty map.
 */
public record Checkpoint(
    String operationId,
    CheckpointType checkpointType,
    Instant createdAt,
    JsonNode state,
    String artifactsPath,
    long stateSizeBytes,
    long artifactsSizeBytes,
    Map<String, byte[]> artifacts
) {
    public Checkpoint {
        artifacts = artifacts == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    public boolean hasArtifacts() {
        return artifactsPath != null;
    }

    /**
     * Create a copy carrying loaded artifact blobs.
     */
    public Checkpoint withArtifacts(Map<String, byte[]> loaded) {
        return new Checkpoint(
            operationId, checkpointType, createdAt, state, artifactsPath,
            stateSizeBytes, artifactsSizeBytes, loaded
        );
    }
}
