package com.quantops.core.checkpoint;

import com.quantops.core.exception.ArtifactValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Names of the binary artifacts a checkpoint must or may carry.
 */
public record ArtifactManifest(Set<String> required, Set<String> optional) {

    /**
     * Model training checkpoints: weights and optimizer state are required.
     */
    public static final ArtifactManifest MODEL_CHECKPOINT = new ArtifactManifest(
        Set.of("model.pt", "optimizer.pt"),
        Set.of("scheduler.pt", "best_model.pt")
    );

    /**
     * No constraints.
     */
    public static final ArtifactManifest NONE = new ArtifactManifest(Set.of(), Set.of());

    public ArtifactManifest {
        required = Set.copyOf(required);
        optional = Set.copyOf(optional);
    }

    /**
     * Validate that every required artifact is present and non-empty.
     *
     * @throws ArtifactValidationException listing every missing or empty artifact
     */
    public void validate(String operationId, Map<String, byte[]> artifacts) {
        List<String> invalid = new ArrayList<>();
        for (String name : required.stream().sorted().toList()) {
            byte[] content = artifacts.get(name);
            if (content == null) {
                invalid.add(name + " (missing)");
            } else if (content.length == 0) {
                invalid.add(name + " (empty)");
            }
        }
        if (!invalid.isEmpty()) {
            throw new ArtifactValidationException(operationId, invalid);
        }
    }
}
