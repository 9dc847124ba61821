package com.quantops.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantops.core.cancellation.CancellationToken;
import com.quantops.core.exception.InvalidStateTransitionException;
import com.quantops.core.exception.NotFoundException;
import com.quantops.core.exception.OperationConflictException;
import com.quantops.core.exception.OptimisticLockException;
import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationProgress;
import com.quantops.core.model.OperationStatus;
import com.quantops.core.model.OperationType;
import com.quantops.core.progress.MetricsPage;
import com.quantops.core.progress.ProgressBridge;
import com.quantops.core.repository.OperationFilter;
import com.quantops.core.repository.OperationPage;
import com.quantops.core.repository.OperationRepository;
import com.quantops.engine.checkpoint.CheckpointService;
import com.quantops.engine.metrics.OperationMetrics;
import com.quantops.engine.service.OperationsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Operation state machine and resume protection.
 *
 * Every write is a compare-and-set on the operation version: a writer that
 * loses re-reads, re-validates the transition against the fresh status and
 * retries. A cancel racing a worker's own completion therefore resolves to
 * exactly one terminal status.
 */
public class OperationRegistry implements OperationsService {

    private static final Logger log = LoggerFactory.getLogger(OperationRegistry.class);

    private static final int MAX_WRITE_ATTEMPTS = 10;
    private static final int PURGE_BATCH_SIZE = 100;

    public static final String CANCELLATION_REASON = "cancellation_reason";

    /**
     * Share of parent progress covered by each child phase: [start, end) in percent.
     */
    private static final Map<OperationType, double[]> PHASE_WEIGHTS = new EnumMap<>(Map.of(
        OperationType.AGENT_DESIGN, new double[] {0.0, 5.0},
        OperationType.TRAINING, new double[] {5.0, 80.0},
        OperationType.BACKTESTING, new double[] {80.0, 100.0},
        OperationType.AGENT_ASSESSMENT, new double[] {100.0, 100.0}
    ));

    private final OperationRepository repository;
    private final CheckpointService checkpointService;
    private final OperationMetrics metrics;
    private final Clock clock;

    private final Map<String, ProgressBridge> bridges = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    public OperationRegistry(
            OperationRepository repository,
            CheckpointService checkpointService,
            OperationMetrics metrics,
            Clock clock) {
        this.repository = repository;
        this.checkpointService = checkpointService;
        this.metrics = metrics;
        this.clock = clock;
        metrics.trackActiveOperations(repository::countActive);
    }

    // ========== Creation ==========

    @Override
    public Operation create(OperationType type, Map<String, Object> metadata, String parentOperationId) {
        return create(Operation.generateId(type, clock.instant()), type, metadata, parentOperationId);
    }

    @Override
    public Operation create(
            String operationId,
            OperationType type,
            Map<String, Object> metadata,
            String parentOperationId) {
        Operation operation = new Operation(
            operationId, type, parentOperationId, OperationStatus.PENDING,
            metadata, OperationProgress.empty(), null, null,
            clock.instant(), null, null, 0L
        );
        repository.save(operation);
        metrics.operationCreated(type);

        log.info("Created {} operation {}{}", type, operationId,
            parentOperationId != null ? " (parent " + parentOperationId + ")" : "");
        return operation;
    }

    @Override
    public Operation adopt(String operationId, OperationType type, Map<String, Object> metadata) {
        Instant now = clock.instant();
        Operation operation = new Operation(
            operationId, type, null, OperationStatus.RESUMING,
            metadata, OperationProgress.empty(), null, null,
            now, now, null, 0L
        );
        repository.save(operation);
        log.info("Adopted {} operation {} for resume", type, operationId);
        return operation;
    }

    // ========== Transitions ==========

    @Override
    public Operation start(String operationId) {
        Operation started = transition(operationId, OperationStatus.RUNNING,
            b -> b.startedAt(clock.instant()));
        log.info("Operation {} running", operationId);
        return started;
    }

    @Override
    public Operation complete(String operationId, JsonNode resultSummary) {
        Operation completed = transition(operationId, OperationStatus.COMPLETED,
            b -> b.resultSummary(resultSummary).completedAt(clock.instant()));

        // A completed operation never keeps a restart point
        checkpointService.delete(operationId);

        metrics.operationCompleted(completed.operationType());
        log.info("Operation {} completed", operationId);
        return completed;
    }

    @Override
    public Operation fail(String operationId, String errorMessage) {
        Operation failed = transition(operationId, OperationStatus.FAILED,
            b -> b.errorMessage(errorMessage).completedAt(clock.instant()));

        metrics.operationFailed(failed.operationType());
        log.warn("Operation {} failed: {}", operationId, errorMessage);
        return failed;
    }

    @Override
    public Operation cancel(String operationId, String reason) {
        Operation cancelled = mutate(operationId, current -> {
            if (!current.status().isCancellable()) {
                throw new OperationConflictException(operationId, current.status(), "cancel");
            }
            Map<String, Object> metadata = new LinkedHashMap<>(current.metadata());
            metadata.put(CANCELLATION_REASON, reason);
            return current.toBuilder()
                .status(OperationStatus.CANCELLED)
                .metadata(metadata)
                .completedAt(clock.instant())
                .incrementVersion()
                .build();
        });

        CancellationToken token = tokens.get(operationId);
        if (token != null) {
            token.cancel(reason);
        }

        metrics.operationCancelled(cancelled.operationType());
        log.info("Operation {} cancelled: {}", operationId, reason);
        return cancelled;
    }

    @Override
    public boolean tryResume(String operationId) {
        boolean won = repository.tryResume(operationId, clock.instant());
        Operation current = repository.findById(operationId)
            .orElseThrow(() -> new NotFoundException("Operation", operationId));

        if (won) {
            metrics.operationResumed(current.operationType());
            log.info("Operation {} resuming", operationId);
        } else {
            metrics.resumeConflict(current.operationType());
            log.warn("Resume of operation {} rejected in status {}", operationId, current.status());
        }
        return won;
    }

    // ========== Progress & Metadata ==========

    @Override
    public Operation updateProgress(String operationId, OperationProgress progress) {
        return mutate(operationId, current -> current.withProgress(progress));
    }

    @Override
    public Operation updateMetadata(String operationId, Map<String, Object> entries) {
        return mutate(operationId, current -> current.withMetadata(entries));
    }

    @Override
    public MetricsPage metrics(String operationId, int cursor) {
        ProgressBridge bridge = bridges.get(operationId);
        if (bridge != null) {
            return bridge.readMetrics(cursor);
        }
        require(operationId);
        return new MetricsPage(List.of(), Math.max(cursor, 0));
    }

    @Override
    public void registerBridge(String operationId, ProgressBridge bridge) {
        bridges.put(operationId, bridge);
    }

    @Override
    public void registerCancellationToken(String operationId, CancellationToken token) {
        tokens.put(operationId, token);
    }

    @Override
    public void release(String operationId) {
        refreshFromBridge(operationId);
        bridges.remove(operationId);
        tokens.remove(operationId);
    }

    @Override
    public boolean hasLocalExecution(String operationId) {
        return tokens.containsKey(operationId);
    }

    // ========== Queries ==========

    @Override
    public Operation get(String operationId) {
        Operation refreshed = refreshFromBridge(operationId);
        return refreshed != null ? refreshed : require(operationId);
    }

    @Override
    public Optional<Operation> find(String operationId) {
        return repository.findById(operationId);
    }

    @Override
    public OperationPage list(OperationFilter filter) {
        return new OperationPage(
            repository.find(filter),
            repository.count(filter),
            repository.countActive()
        );
    }

    @Override
    public List<Operation> children(String parentOperationId) {
        return repository.findByParent(parentOperationId);
    }

    @Override
    public OperationProgress aggregateChildProgress(String parentOperationId) {
        List<Operation> children = children(parentOperationId);
        if (children.isEmpty()) {
            return OperationProgress.of(0.0, "Waiting for first phase", clock.instant());
        }
        Operation latest = children.get(children.size() - 1);
        Operation current = get(latest.operationId());
        double[] weight = PHASE_WEIGHTS.getOrDefault(current.operationType(), new double[] {0.0, 100.0});
        double childPercent = current.status() == OperationStatus.COMPLETED
            ? 100.0
            : current.progress().percentage();
        double percentage = weight[0] + (weight[1] - weight[0]) * childPercent / 100.0;

        String childMessage = current.progress().message();
        String message = current.operationType().kind()
            + (childMessage != null ? ": " + childMessage : "");
        return new OperationProgress(
            percentage,
            message,
            current.operationType().kind(),
            children.size(),
            PHASE_WEIGHTS.size(),
            Map.of("child_operation_id", current.operationId()),
            clock.instant()
        );
    }

    @Override
    public int purgeFinishedBefore(Instant cutoff) {
        int purged = 0;
        for (Operation operation : repository.findFinishedBefore(cutoff, PURGE_BATCH_SIZE)) {
            checkpointService.delete(operation.operationId());
            if (repository.delete(operation.operationId())) {
                purged++;
            }
        }
        if (purged > 0) {
            log.info("Purged {} operations finished before {}", purged, cutoff);
        }
        return purged;
    }

    // ========== Helper Methods ==========

    private Operation require(String operationId) {
        return repository.findById(operationId)
            .orElseThrow(() -> new NotFoundException("Operation", operationId));
    }

    private Operation refreshFromBridge(String operationId) {
        ProgressBridge bridge = bridges.get(operationId);
        if (bridge == null) {
            return null;
        }
        OperationProgress latest = bridge.toOperationProgress();
        Operation current = require(operationId);
        Instant stored = current.progress().updatedAt();
        if (latest.updatedAt() == null || (stored != null && !latest.updatedAt().isAfter(stored))) {
            return current;
        }
        log.debug("Refreshing progress of {} from bridge: {}%", operationId, latest.percentage());
        return updateProgress(operationId, latest);
    }

    private Operation transition(
            String operationId,
            OperationStatus target,
            UnaryOperator<Operation.Builder> changes) {
        return mutate(operationId, current -> {
            if (!current.status().canTransitionTo(target)) {
                throw new InvalidStateTransitionException(operationId, current.status(), target);
            }
            return changes.apply(current.toBuilder().status(target))
                .incrementVersion()
                .build();
        });
    }

    /**
     * Read-modify-write with optimistic locking. The function sees the latest
     * stored operation on every attempt and must return a copy with version + 1.
     */
    private Operation mutate(String operationId, UnaryOperator<Operation> change) {
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            Operation current = require(operationId);
            Operation updated = change.apply(current);
            try {
                repository.update(updated);
                return updated;
            } catch (OptimisticLockException e) {
                log.debug("Concurrent write on {} (attempt {}), retrying", operationId, attempt);
            }
        }
        throw new OptimisticLockException("Operation", operationId);
    }
}
