package com.quantops.engine.health;

import com.quantops.core.model.OperationStatus;
import com.quantops.core.model.WorkerStatus;
import com.quantops.core.repository.OperationRepository;
import com.quantops.engine.checkpoint.CheckpointService;
import com.quantops.engine.registry.WorkerRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for the orchestrator.
 * Reports health status based on:
 * - Operation store reachability
 * - Worker pool state
 * - Checkpoint artifact directory writability
 */
public class OrchestratorHealthIndicator implements HealthIndicator {

    private final OperationRepository operationRepository;
    private final WorkerRegistry workerRegistry;
    private final CheckpointService checkpointService;

    public OrchestratorHealthIndicator(
            OperationRepository operationRepository,
            WorkerRegistry workerRegistry,
            CheckpointService checkpointService) {
        this.operationRepository = operationRepository;
        this.workerRegistry = workerRegistry;
        this.checkpointService = checkpointService;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            if (!checkOperations(details) || !checkArtifacts(details)) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            checkWorkers(details);

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private boolean checkOperations(Map<String, Object> details) {
        try {
            Map<String, Long> counts = new HashMap<>();
            for (Map.Entry<OperationStatus, Long> entry : operationRepository.countByStatus().entrySet()) {
                counts.put(entry.getKey().name(), entry.getValue());
            }
            details.put("operations", counts);
            return true;
        } catch (Exception e) {
            details.put("operationStore", "unreachable");
            details.put("operationStoreError", e.getMessage());
            return false;
        }
    }

    private void checkWorkers(Map<String, Object> details) {
        Map<String, Long> counts = new HashMap<>();
        for (WorkerStatus status : WorkerStatus.values()) {
            counts.put(status.name(), workerRegistry.countByStatus(status));
        }
        details.put("workers", counts);

        if (counts.get(WorkerStatus.UNREACHABLE.name()) > 0) {
            details.put("workerWarning", "Some workers missed their heartbeat");
        }
    }

    private boolean checkArtifacts(Map<String, Object> details) {
        Path root = checkpointService.artifactsRoot();
        boolean writable = Files.isDirectory(root) && Files.isWritable(root);
        details.put("checkpointArtifacts", writable ? "writable" : "not writable: " + root);
        return writable;
    }
}
