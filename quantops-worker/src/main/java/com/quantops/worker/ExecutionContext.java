package com.quantops.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quantops.core.cancellation.CancellationToken;
import com.quantops.core.checkpoint.ArtifactManifest;
import com.quantops.core.checkpoint.CheckpointPolicy;
import com.quantops.core.exception.CheckpointStorageException;
import com.quantops.core.model.Checkpoint;
import com.quantops.core.model.CheckpointType;
import com.quantops.core.model.OperationType;
import com.quantops.core.model.ResumeContext;
import com.quantops.core.progress.CheckpointingProgressBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Context provided to operation functions during execution.
 */
public class ExecutionContext {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    private final String operationId;
    private final OperationType operationType;
    private final JsonNode request;
    private final CancellationToken token;
    private final CheckpointingProgressBridge bridge;
    private final ResumeContext resumeContext;
    private final CheckpointPolicy policy;
    private final CheckpointWriter writer;
    private final ArtifactManifest manifest;
    private final ObjectMapper objectMapper;

    private volatile int lastKnownUnit = -1;
    private volatile Supplier<JsonNode> lastKnownState;
    private volatile Supplier<Map<String, byte[]>> lastKnownArtifacts;

    public ExecutionContext(
            String operationId,
            OperationType operationType,
            JsonNode request,
            CancellationToken token,
            CheckpointingProgressBridge bridge,
            ResumeContext resumeContext,
            CheckpointPolicy policy,
            CheckpointWriter writer,
            ArtifactManifest manifest,
            ObjectMapper objectMapper) {
        this.operationId = operationId;
        this.operationType = operationType;
        this.request = request != null ? request : objectMapper.createObjectNode();
        this.token = token;
        this.bridge = bridge;
        this.resumeContext = resumeContext;
        this.policy = policy;
        this.writer = writer;
        this.manifest = manifest;
        this.objectMapper = objectMapper;
    }

    public String getOperationId() {
        return operationId;
    }

    public OperationType getOperationType() {
        return operationType;
    }

    /**
     * The original request. On a resumed run this is the request restored from the checkpoint.
     */
    public JsonNode getRequest() {
        return request;
    }

    /**
     * Get the request as a specific type.
     */
    public <T> T getRequest(Class<T> type) {
        return objectMapper.convertValue(request, type);
    }

    /**
     * Checkpoint restored for this run, empty on a fresh start.
     */
    public Optional<ResumeContext> getResumeContext() {
        return Optional.ofNullable(resumeContext);
    }

    /**
     * First unit to execute: 0 on a fresh start, the number of checkpointed units on resume.
     */
    public int startUnit() {
        return resumeContext != null ? resumeContext.resumeFromUnit() : 0;
    }

    public CheckpointingProgressBridge progress() {
        return bridge;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public CancellationToken getCancellationToken() {
        return token;
    }

    /**
     * Throw {@link com.quantops.core.exception.OperationCancelledException} if cancellation was requested.
     */
    public void throwIfCancelled() {
        token.throwIfCancelled();
    }

    // ========== Checkpoints ==========

    /**
     * Save a periodic checkpoint if the policy says one is due.
     *
     * A failed save is logged and the run continues; the previous checkpoint
     * stays in place.
     *
     * @param unitsCompleted Units finished so far; the resumed run starts at this index
     * @param state Domain state to restore, evaluated only when a checkpoint is written
     * @param artifacts Binary artifacts, evaluated only when a checkpoint is written
     * @return true if a checkpoint was written
     */
    public boolean checkpointIfDue(
            int unitsCompleted,
            Supplier<JsonNode> state,
            Supplier<Map<String, byte[]>> artifacts) {
        lastKnownUnit = unitsCompleted;
        lastKnownState = state;
        lastKnownArtifacts = artifacts;

        if (!policy.shouldCheckpoint(unitsCompleted)) {
            return false;
        }
        return writePeriodic(unitsCompleted, state, artifacts);
    }

    public boolean checkpointIfDue(int unitsCompleted, Supplier<JsonNode> state) {
        return checkpointIfDue(unitsCompleted, state, Map::of);
    }

    /**
     * Save a periodic checkpoint regardless of the policy, e.g. at a phase boundary.
     *
     * @return true if the checkpoint was written
     */
    public boolean checkpointNow(int unitsCompleted, JsonNode state) {
        lastKnownUnit = unitsCompleted;
        lastKnownState = () -> state;
        lastKnownArtifacts = Map::of;
        return writePeriodic(unitsCompleted, () -> state, Map::of);
    }

    /**
     * Save the checkpoint a cancelled run resumes from. Written as a
     * {@code shutdown} checkpoint when the worker is shutting down.
     */
    public Checkpoint saveCancellationCheckpoint(
            int unitsCompleted,
            JsonNode state,
            Map<String, byte[]> artifacts) {
        CheckpointType type = token.isShutdown() ? CheckpointType.SHUTDOWN : CheckpointType.CANCELLATION;
        return save(type, unitsCompleted, state, artifacts);
    }

    public Checkpoint saveCancellationCheckpoint(int unitsCompleted, JsonNode state) {
        return saveCancellationCheckpoint(unitsCompleted, state, Map.of());
    }

    /**
     * Whether a unit boundary has been reported through {@link #checkpointIfDue}.
     */
    boolean hasKnownState() {
        return lastKnownState != null;
    }

    /**
     * Save a {@code failure} checkpoint from the last reported unit boundary.
     */
    Checkpoint saveFailureCheckpoint() {
        return save(CheckpointType.FAILURE, lastKnownUnit, lastKnownState.get(), lastKnownArtifacts.get());
    }

    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }

    // ========== Helper Methods ==========

    private boolean writePeriodic(
            int unitsCompleted,
            Supplier<JsonNode> state,
            Supplier<Map<String, byte[]>> artifacts) {
        try {
            save(CheckpointType.PERIODIC, unitsCompleted, state.get(), artifacts.get());
            policy.recordCheckpoint(unitsCompleted);
            return true;
        } catch (CheckpointStorageException e) {
            log.warn("Periodic checkpoint of {} at unit {} failed: {}", operationId, unitsCompleted, e.getMessage());
            return false;
        }
    }

    private Checkpoint save(CheckpointType type, int unitsCompleted, JsonNode state, Map<String, byte[]> artifacts) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put(ResumeContext.UNIT_INDEX, unitsCompleted);
        envelope.set(ResumeContext.ORIGINAL_REQUEST, request);
        envelope.set(ResumeContext.STATE, state != null ? state : objectMapper.createObjectNode());

        Checkpoint saved = writer.save(operationId, type, envelope, artifacts, manifest);

        Map<String, Object> cached = new LinkedHashMap<>();
        cached.put(ResumeContext.UNIT_INDEX, unitsCompleted);
        cached.put("checkpoint_type", type.wireName());
        cached.put("checkpointed_at", saved.createdAt().toString());
        bridge.updateCheckpointState(cached);
        return saved;
    }
}
