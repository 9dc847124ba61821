package com.quantops.api.rest;

import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationStatus;
import com.quantops.core.model.OperationType;
import com.quantops.core.progress.MetricsPage;
import com.quantops.core.repository.OperationFilter;
import com.quantops.core.repository.OperationPage;
import com.quantops.engine.coordinator.OperationOrchestrator;
import com.quantops.engine.logging.LoggingContext;
import com.quantops.engine.service.OperationsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST API for operation lifecycle: listing, inspection, cancel and resume.
 */
@RestController
@RequestMapping("/api/v1/operations")
public class OperationsController {

    private final OperationsService operations;
    private final OperationOrchestrator orchestrator;

    public OperationsController(OperationsService operations, OperationOrchestrator orchestrator) {
        this.operations = operations;
        this.orchestrator = orchestrator;
    }

    /**
     * List operations, newest first.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listOperations(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String parent,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset) {

        OperationPage page = operations.list(new OperationFilter(
            status != null ? OperationStatus.valueOf(status.toUpperCase(Locale.ROOT)) : null,
            type != null ? parseType(type) : null,
            parent,
            limit,
            offset
        ));

        return ResponseEntity.ok(Map.of(
            "items", page.items(),
            "total_count", page.totalCount(),
            "active_count", page.activeCount()
        ));
    }

    /**
     * Get an operation, pulling fresh progress from a remote worker first.
     */
    @GetMapping("/{operationId}")
    public ResponseEntity<Operation> getOperation(@PathVariable String operationId) {
        return ResponseEntity.ok(orchestrator.refresh(operationId));
    }

    @GetMapping("/{operationId}/children")
    public ResponseEntity<List<Operation>> getChildren(@PathVariable String operationId) {
        operations.get(operationId);
        return ResponseEntity.ok(operations.children(operationId));
    }

    /**
     * Metric records appended since {@code cursor}.
     */
    @GetMapping("/{operationId}/metrics")
    public ResponseEntity<Map<String, Object>> getMetrics(
            @PathVariable String operationId,
            @RequestParam(defaultValue = "0") int cursor) {
        operations.get(operationId);
        MetricsPage page = orchestrator.metrics(operationId, cursor);
        return ResponseEntity.ok(Map.of(
            "metrics", page.metrics(),
            "cursor", page.cursor()
        ));
    }

    @DeleteMapping("/{operationId}")
    public ResponseEntity<Map<String, Object>> cancelOperation(
            @PathVariable String operationId,
            @RequestParam(required = false) String reason) {
        try (var ctx = LoggingContext.forOperation(operationId)) {
            Operation cancelled = orchestrator.cancel(operationId, reason != null ? reason : "Cancelled by user");
            return ResponseEntity.ok(Map.of(
                "success", true,
                "operation_id", operationId,
                "status", cancelled.status().name()
            ));
        }
    }

    /**
     * Resume a cancelled or failed operation from its checkpoint.
     */
    @PostMapping("/{operationId}/resume")
    public ResponseEntity<Map<String, Object>> resumeOperation(@PathVariable String operationId) {
        try (var ctx = LoggingContext.forOperation(operationId)) {
            Operation resumed = orchestrator.resume(operationId);
            return ResponseEntity.ok(Map.of(
                "success", true,
                "operation_id", operationId,
                "status", resumed.status().name()
            ));
        }
    }

    private static OperationType parseType(String type) {
        return OperationType.fromKind(type)
            .orElseGet(() -> OperationType.valueOf(type.toUpperCase(Locale.ROOT)));
    }
}
