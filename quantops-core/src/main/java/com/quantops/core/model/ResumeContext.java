package com.quantops.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Map;

/**
 * Everything an operation function needs to continue from a checkpoint.
 * {@code resumeFromUnit} is the number of units completed when the checkpoint
 * was taken, so a zero-based loop restarts at exactly that index.
 *
 * Checkpoint state is stored as an envelope:
 * <pre>
 * { "unit_index": 12, "original_request": {...}, "state": {...domain state...} }
 * </pre>
 */
public record ResumeContext(
    String operationId,
    int resumeFromUnit,
    JsonNode state,
    JsonNode originalRequest,
    Map<String, byte[]> artifacts,
    CheckpointType checkpointType
) {
    public static final String UNIT_INDEX = "unit_index";
    public static final String ORIGINAL_REQUEST = "original_request";
    public static final String STATE = "state";

    /**
     * Rebuild the resume context from a loaded checkpoint envelope.
     */
    public static ResumeContext fromCheckpoint(Checkpoint checkpoint) {
        JsonNode envelope = checkpoint.state();
        JsonNode empty = JsonNodeFactory.instance.objectNode();
        int unit = envelope != null ? envelope.path(UNIT_INDEX).asInt(0) : 0;
        JsonNode state = envelope != null && envelope.hasNonNull(STATE) ? envelope.get(STATE) : empty;
        JsonNode request = envelope != null && envelope.hasNonNull(ORIGINAL_REQUEST)
            ? envelope.get(ORIGINAL_REQUEST)
            : empty;
        return new ResumeContext(
            checkpoint.operationId(),
            unit,
            state,
            request,
            checkpoint.artifacts(),
            checkpoint.checkpointType()
        );
    }
}
