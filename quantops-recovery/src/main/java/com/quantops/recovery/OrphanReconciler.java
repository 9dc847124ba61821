package com.quantops.recovery;

import com.quantops.core.exception.InvalidStateTransitionException;
import com.quantops.core.exception.QuantOpsException;
import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationStatus;
import com.quantops.core.model.WorkerRegistration;
import com.quantops.core.model.WorkerStatus;
import com.quantops.core.repository.OperationFilter;
import com.quantops.engine.config.QuantOpsProperties;
import com.quantops.engine.coordinator.OperationOrchestrator;
import com.quantops.engine.logging.LoggingContext;
import com.quantops.engine.metrics.OperationMetrics;
import com.quantops.engine.registry.WorkerRegistry;
import com.quantops.engine.service.OperationsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Reconciles operation state with worker liveness.
 *
 * Each sweep:
 * - Marks workers that missed their heartbeat window unreachable
 * - Pulls the status of operations running on reachable remote workers
 * - Fails active operations whose worker is gone, preserving their checkpoints
 * - Frees busy workers whose operation already finished
 * - Removes workers silent past the removal threshold
 * - Purges finished operations older than the retention window
 */
public class OrphanReconciler {

    private static final Logger log = LoggerFactory.getLogger(OrphanReconciler.class);

    private static final int BATCH_SIZE = 100;
    private static final List<OperationStatus> ACTIVE_STATUSES =
        List.of(OperationStatus.PENDING, OperationStatus.RUNNING, OperationStatus.RESUMING);

    private final OperationsService operations;
    private final OperationOrchestrator orchestrator;
    private final WorkerRegistry workers;
    private final OperationMetrics metrics;
    private final QuantOpsProperties.Recovery settings;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public OrphanReconciler(
            OperationsService operations,
            OperationOrchestrator orchestrator,
            WorkerRegistry workers,
            OperationMetrics metrics,
            QuantOpsProperties.Recovery settings,
            Clock clock) {
        this.operations = operations;
        this.orchestrator = orchestrator;
        this.workers = workers;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "orphan-reconciler");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start periodic sweeps.
     */
    public void start() {
        if (running) {
            log.warn("Orphan reconciler already running");
            return;
        }
        running = true;
        long interval = settings.sweepInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Orphan reconciler started (interval: {}, grace period: {}, retention: {})",
            settings.sweepInterval(), settings.orphanGracePeriod(), settings.retention());
    }

    /**
     * Stop periodic sweeps.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Orphan reconciler stopped");
    }

    private void sweep() {
        if (!running) {
            return;
        }
        try {
            reconcile();
        } catch (RuntimeException e) {
            log.error("Error in reconciliation sweep", e);
        }
    }

    /**
     * Run one reconciliation sweep.
     */
    public Report reconcile() {
        List<WorkerRegistration> stale = workers.markStaleWorkers();
        int refreshed = refreshRemoteOperations();
        List<String> orphaned = failOrphanedOperations();
        int released = releaseFinishedWorkers();
        List<WorkerRegistration> removed = workers.removeDeadWorkers();
        int purged = purgeExpired();

        Report report = new Report(stale.size(), refreshed, orphaned, released, removed.size(), purged);
        if (report.hasChanges()) {
            log.info("Reconciliation: {}", report);
        }
        return report;
    }

    // ========== Sweep Steps ==========

    private int refreshRemoteOperations() {
        int refreshed = 0;
        for (Operation operation : activeOperations()) {
            Optional<WorkerRegistration> worker = workers.findByOperation(operation.operationId());
            if (worker.isEmpty() || worker.get().isInProcess() || worker.get().status() == WorkerStatus.UNREACHABLE) {
                continue;
            }
            try {
                Operation current = orchestrator.refresh(operation.operationId());
                if (current.status().isTerminal()) {
                    refreshed++;
                }
            } catch (QuantOpsException e) {
                log.warn("Failed to refresh operation {}: {}", operation.operationId(), e.getMessage());
            }
        }
        return refreshed;
    }

    private List<String> failOrphanedOperations() {
        Instant graceCutoff = clock.instant().minus(settings.orphanGracePeriod());
        List<String> orphaned = new ArrayList<>();

        for (Operation operation : activeOperations()) {
            String operationId = operation.operationId();
            if (operations.hasLocalExecution(operationId) || !lastTransitionBefore(operation, graceCutoff)) {
                continue;
            }
            String reason = orphanReason(operation);
            if (reason == null) {
                continue;
            }

            try (var ctx = LoggingContext.forOperation(operationId, operation.operationType().name(),
                    operation.parentOperationId())) {
                operations.fail(operationId, "Operation orphaned: " + reason);
                workers.releaseOperation(operationId);
                metrics.orphanRecovered(operation.operationType());
                orphaned.add(operationId);
                log.warn("Marked operation {} failed: {}; checkpoint kept for resume", operationId, reason);
            } catch (InvalidStateTransitionException e) {
                log.debug("Operation {} changed status during reconciliation: {}", operationId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to reconcile operation {}", operationId, e);
            }
        }
        return orphaned;
    }

    private int releaseFinishedWorkers() {
        int released = 0;
        for (WorkerRegistration worker : workers.list()) {
            String operationId = worker.currentOperationId();
            if (worker.status() != WorkerStatus.BUSY || operationId == null) {
                continue;
            }
            Optional<Operation> operation = operations.find(operationId);
            if (operation.isEmpty() || operation.get().status().isTerminal()) {
                workers.releaseOperation(operationId);
                released++;
                log.info("Freed worker {} held by finished operation {}", worker.workerId(), operationId);
            }
        }
        return released;
    }

    private int purgeExpired() {
        Duration retention = settings.retention();
        if (retention.isZero() || retention.isNegative()) {
            return 0;
        }
        try {
            return operations.purgeFinishedBefore(clock.instant().minus(retention));
        } catch (RuntimeException e) {
            log.error("Retention purge failed", e);
            return 0;
        }
    }

    // ========== Helper Methods ==========

    private List<Operation> activeOperations() {
        List<Operation> active = new ArrayList<>();
        for (OperationStatus status : ACTIVE_STATUSES) {
            active.addAll(operations.list(new OperationFilter(status, null, null, BATCH_SIZE, 0)).items());
        }
        return active;
    }

    /**
     * Why an active operation without a local execution has no live worker, or null if it has one.
     */
    private String orphanReason(Operation operation) {
        String workerId = operation.metadataString(OperationOrchestrator.WORKER_ID);
        if (workerId == null) {
            return "no worker recorded";
        }
        Optional<WorkerRegistration> worker = workers.find(workerId);
        if (worker.isEmpty()) {
            return "worker " + workerId + " is no longer registered";
        }
        if (worker.get().isInProcess()) {
            return "in-process run of worker " + workerId + " is gone";
        }
        if (worker.get().status() == WorkerStatus.UNREACHABLE) {
            return "worker " + workerId + " stopped sending heartbeats";
        }
        return null;
    }

    private static boolean lastTransitionBefore(Operation operation, Instant cutoff) {
        Instant last = operation.startedAt() != null ? operation.startedAt() : operation.createdAt();
        return last.isBefore(cutoff);
    }

    /**
     * Outcome of one sweep.
     */
    public record Report(
        int staleWorkers,
        int refreshedOperations,
        List<String> orphanedOperations,
        int releasedWorkers,
        int removedWorkers,
        int purgedOperations
    ) {
        public Report {
            orphanedOperations = List.copyOf(orphanedOperations);
        }

        public boolean hasChanges() {
            return staleWorkers > 0 || refreshedOperations > 0 || !orphanedOperations.isEmpty()
                || releasedWorkers > 0 || removedWorkers > 0 || purgedOperations > 0;
        }
    }
}
