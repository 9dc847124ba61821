package com.quantops.worker.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.quantops.core.exception.NotFoundException;
import com.quantops.core.exception.OperationConflictException;
import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationType;
import com.quantops.core.progress.MetricsPage;
import com.quantops.engine.logging.LoggingContext;
import com.quantops.engine.service.OperationsService;
import com.quantops.worker.GracefulShutdownHandler;
import com.quantops.worker.WorkerRuntime;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP surface of a standalone worker, called by the orchestrator's HTTP gateway.
 */
@RestController
public class WorkerOperationsController {

    private final Map<OperationType, WorkerRuntime> runtimes = new EnumMap<>(OperationType.class);
    private final OperationsService operations;
    private final GracefulShutdownHandler shutdownHandler;

    public WorkerOperationsController(
            List<WorkerRuntime> runtimes,
            OperationsService operations,
            GracefulShutdownHandler shutdownHandler) {
        runtimes.forEach(r -> this.runtimes.put(r.operationType(), r));
        this.operations = operations;
        this.shutdownHandler = shutdownHandler;
    }

    // ========== Lifecycle ==========

    /**
     * Start a run; the operation id is assigned by the orchestrator.
     */
    @PostMapping("/{kind}/start")
    public ResponseEntity<Map<String, Object>> start(
            @PathVariable String kind,
            @RequestBody StartRequest request) {
        WorkerRuntime runtime = runtimeFor(kind);
        rejectDuringShutdown();

        try (var ctx = LoggingContext.forOperation(request.operationId())) {
            Operation operation = runtime.start(request.parameters(), request.operationId(), request.parentOperationId());
            return ResponseEntity.ok(started(operation));
        }
    }

    /**
     * Resume a cancelled or failed run from its checkpoint.
     */
    @PostMapping("/{kind}/resume")
    public ResponseEntity<Map<String, Object>> resume(
            @PathVariable String kind,
            @RequestBody ResumeRequest request) {
        WorkerRuntime runtime = runtimeFor(kind);
        if (request.operationId() == null || request.operationId().isBlank()) {
            throw new IllegalArgumentException("operation_id is required");
        }
        rejectDuringShutdown();

        try (var ctx = LoggingContext.forOperation(request.operationId())) {
            Operation operation = runtime.resume(request.operationId());
            return ResponseEntity.ok(started(operation));
        }
    }

    /**
     * Cancel a run. It stops at its next unit boundary.
     */
    @DeleteMapping("/operations/{operationId}")
    public ResponseEntity<Map<String, Object>> cancel(
            @PathVariable String operationId,
            @RequestParam(required = false) String reason) {
        Operation current = operations.get(operationId);
        WorkerRuntime runtime = runtimes.get(current.operationType());
        Operation cancelled = runtime != null
            ? runtime.cancel(operationId, reason)
            : operations.cancel(operationId, reason != null ? reason : "Cancelled by request");

        return ResponseEntity.ok(Map.of(
            "success", true,
            "operation_id", operationId,
            "status", cancelled.status().name()
        ));
    }

    // ========== Queries ==========

    @GetMapping("/operations/{operationId}")
    public ResponseEntity<Operation> getOperation(@PathVariable String operationId) {
        return ResponseEntity.ok(operations.get(operationId));
    }

    /**
     * Metric records appended since {@code cursor}.
     */
    @GetMapping("/operations/{operationId}/metrics")
    public ResponseEntity<Map<String, Object>> getMetrics(
            @PathVariable String operationId,
            @RequestParam(defaultValue = "0") int cursor) {
        operations.get(operationId);
        MetricsPage page = operations.metrics(operationId, cursor);
        return ResponseEntity.ok(Map.of(
            "metrics", page.metrics(),
            "cursor", page.cursor()
        ));
    }

    // ========== Helper Methods ==========

    private WorkerRuntime runtimeFor(String kind) {
        return OperationType.fromKind(kind)
            .map(runtimes::get)
            .orElseThrow(() -> new NotFoundException("Worker kind", kind));
    }

    private void rejectDuringShutdown() {
        if (shutdownHandler.isShuttingDown()) {
            throw new OperationConflictException("Worker is shutting down");
        }
    }

    private static Map<String, Object> started(Operation operation) {
        return Map.of(
            "success", true,
            "operation_id", operation.operationId(),
            "status", "started"
        );
    }

    // ========== DTOs ==========

    public record StartRequest(
        @JsonProperty("operation_id") String operationId,
        @JsonProperty("parent_operation_id") String parentOperationId,
        JsonNode parameters
    ) {}

    public record ResumeRequest(
        @JsonProperty("operation_id") String operationId
    ) {}
}
