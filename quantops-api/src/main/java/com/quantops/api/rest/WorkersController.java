package com.quantops.api.rest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quantops.core.model.OperationType;
import com.quantops.core.model.WorkerCapabilities;
import com.quantops.core.model.WorkerRegistration;
import com.quantops.engine.logging.LoggingContext;
import com.quantops.engine.registry.WorkerRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for worker self-registration and heartbeats.
 */
@RestController
public class WorkersController {

    private final WorkerRegistry workerRegistry;

    public WorkersController(WorkerRegistry workerRegistry) {
        this.workerRegistry = workerRegistry;
    }

    /**
     * Register (or re-register) a standalone worker.
     */
    @PostMapping({"/api/v1/workers/register", "/workers/register"})
    public ResponseEntity<WorkerResponse> register(@RequestBody RegisterRequest request) {
        if (request.workerId() == null || request.workerId().isBlank()) {
            throw new IllegalArgumentException("worker_id is required");
        }
        if (request.endpointUrl() == null || request.endpointUrl().isBlank()) {
            throw new IllegalArgumentException("endpoint_url is required");
        }
        OperationType type = OperationType.fromKind(request.workerType())
            .orElseThrow(() -> new IllegalArgumentException("Unknown worker_type: " + request.workerType()));

        try (var ctx = LoggingContext.forWorker(request.workerId())) {
            WorkerRegistration registration = workerRegistry.register(
                request.workerId(), type, request.endpointUrl(),
                request.capabilities() != null ? request.capabilities() : WorkerCapabilities.cpuOnly());
            return ResponseEntity.ok(WorkerResponse.from(registration));
        }
    }

    /**
     * Record a heartbeat. Unknown workers get 404 and register again.
     */
    @PostMapping("/api/v1/workers/{workerId}/heartbeat")
    public ResponseEntity<Map<String, Object>> heartbeat(@PathVariable String workerId) {
        WorkerRegistration registration = workerRegistry.heartbeat(workerId);
        return ResponseEntity.ok(Map.of(
            "worker_id", workerId,
            "status", registration.status().name()
        ));
    }

    @GetMapping("/api/v1/workers")
    public ResponseEntity<List<WorkerResponse>> listWorkers() {
        return ResponseEntity.ok(workerRegistry.list().stream()
            .map(WorkerResponse::from)
            .toList());
    }

    // ========== DTOs ==========

    public record RegisterRequest(
        @JsonProperty("worker_id") String workerId,
        @JsonProperty("worker_type") String workerType,
        @JsonProperty("endpoint_url") String endpointUrl,
        WorkerCapabilities capabilities
    ) {}

    public record WorkerResponse(
        @JsonProperty("worker_id") String workerId,
        @JsonProperty("worker_type") String workerType,
        @JsonProperty("endpoint_url") String endpointUrl,
        String status,
        @JsonProperty("current_operation_id") String currentOperationId,
        @JsonProperty("last_heartbeat_at") Instant lastHeartbeatAt,
        WorkerCapabilities capabilities
    ) {
        public static WorkerResponse from(WorkerRegistration registration) {
            return new WorkerResponse(
                registration.workerId(),
                registration.workerType().kind(),
                registration.endpointUrl(),
                registration.status().name(),
                registration.currentOperationId(),
                registration.lastHeartbeatAt(),
                registration.capabilities()
            );
        }
    }
}
