package com.quantops.core.exception;

import java.util.List;

/**
 * Thrown when checkpoint artifacts are missing or empty.
 */
public class ArtifactValidationException extends QuantOpsException {

    public static final String ERROR_CODE = "ARTIFACT_VALIDATION_FAILED";

    private final List<String> invalidArtifacts;

    public ArtifactValidationException(String operationId, List<String> invalidArtifacts) {
        super(ERROR_CODE, String.format(
            "Invalid checkpoint artifacts for %s: %s",
            operationId, invalidArtifacts
        ));
        this.invalidArtifacts = List.copyOf(invalidArtifacts);
    }

    public List<String> getInvalidArtifacts() {
        return invalidArtifacts;
    }
}
