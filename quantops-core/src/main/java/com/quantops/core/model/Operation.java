package com.quantops.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A single long-running job: training run, backtest or research cycle.
 * Primary source of truth for operation status.
 *
 * Primary Key: operationId
 *
 * Invariants:
 * - resultSummary is only present on COMPLETED operations
 * - errorMessage is only present on FAILED operations
 * - version is monotonically increasing (optimistic locking)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Operation(
    // Identity
    String operationId,
    OperationType operationType,
    String parentOperationId,

    // State
    OperationStatus status,
    Map<String, Object> metadata,
    OperationProgress progress,

    // Outcome
    JsonNode resultSummary,
    String errorMessage,

    // Timing
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,

    // Versioning (optimistic locking)
    long version
) {
    private static final DateTimeFormatter ID_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    public Operation {
        if (operationId == null || operationId.isBlank()) {
            throw new IllegalArgumentException("operationId is required");
        }
        if (operationType == null || status == null) {
            throw new IllegalArgumentException("operationType and status are required");
        }
        if (resultSummary != null && resultSummary.isNull()) {
            resultSummary = null;
        }
        if (resultSummary != null && status != OperationStatus.COMPLETED) {
            throw new IllegalArgumentException(
                "resultSummary is only allowed on COMPLETED operations, got " + status);
        }
        if (errorMessage != null && status != OperationStatus.FAILED) {
            throw new IllegalArgumentException(
                "errorMessage is only allowed on FAILED operations, got " + status);
        }
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        progress = progress == null ? OperationProgress.empty() : progress;
    }

    /**
     * Create a new operation in PENDING state with a system-assigned id.
     */
    public static Operation create(
            OperationType type,
            Map<String, Object> metadata,
            String parentOperationId,
            Instant createdAt) {
        return create(generateId(type, createdAt), type, metadata, parentOperationId, createdAt);
    }

    /**
     * Create a new operation in PENDING state with a caller-supplied id.
     */
    public static Operation create(
            String operationId,
            OperationType type,
            Map<String, Object> metadata,
            String parentOperationId,
            Instant createdAt) {
        return new Operation(
            operationId,
            type,
            parentOperationId,
            OperationStatus.PENDING,
            metadata,
            OperationProgress.empty(),
            null,
            null,
            createdAt,
            null,
            null,
            0L
        );
    }

    /**
     * Generate an id of the form {@code op_<type>_<yyyyMMdd_HHmmss>_<8 hex>}.
     */
    public static String generateId(OperationType type, Instant now) {
        return "op_" + type.name().toLowerCase() + "_" + ID_TIMESTAMP.format(now)
            + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    @JsonIgnore
    public boolean isChild() {
        return parentOperationId != null;
    }

    /**
     * Read a metadata entry as a string, or null when absent.
     */
    public String metadataString(String key) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Create a copy with updated progress.
     */
    public Operation withProgress(OperationProgress newProgress) {
        return toBuilder().progress(newProgress).incrementVersion().build();
    }

    /**
     * Create a copy with metadata entries merged in.
     */
    public Operation withMetadata(Map<String, Object> entries) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(entries);
        return toBuilder().metadata(merged).incrementVersion().build();
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final String operationId;
        private final OperationType operationType;
        private final String parentOperationId;
        private OperationStatus status;
        private Map<String, Object> metadata;
        private OperationProgress progress;
        private JsonNode resultSummary;
        private String errorMessage;
        private final Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private long version;

        public Builder(Operation operation) {
            this.operationId = operation.operationId();
            this.operationType = operation.operationType();
            this.parentOperationId = operation.parentOperationId();
            this.status = operation.status();
            this.metadata = operation.metadata();
            this.progress = operation.progress();
            this.resultSummary = operation.resultSummary();
            this.errorMessage = operation.errorMessage();
            this.createdAt = operation.createdAt();
            this.startedAt = operation.startedAt();
            this.completedAt = operation.completedAt();
            this.version = operation.version();
        }

        public Builder status(OperationStatus status) {
            this.status = status;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder progress(OperationProgress progress) {
            this.progress = progress;
            return this;
        }

        public Builder resultSummary(JsonNode resultSummary) {
            this.resultSummary = resultSummary;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder incrementVersion() {
            this.version++;
            return this;
        }

        public Operation build() {
            return new Operation(
                operationId, operationType, parentOperationId, status,
                metadata, progress, resultSummary, errorMessage,
                createdAt, startedAt, completedAt, version
            );
        }
    }
}
