package com.quantops.engine.registry;

import com.quantops.core.exception.NotFoundException;
import com.quantops.core.model.OperationType;
import com.quantops.core.model.WorkerCapabilities;
import com.quantops.core.model.WorkerRegistration;
import com.quantops.core.model.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of worker processes.
 *
 * Selection is least-recently-selected first among idle, non-stale workers of
 * the requested type, which spreads operations round-robin across a pool.
 * Registrations are not persisted: workers re-register after an orchestrator
 * restart.
 */
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private static final Comparator<WorkerRegistration> LEAST_RECENTLY_SELECTED =
        Comparator.comparing(WorkerRegistration::lastSelectedAt,
            Comparator.nullsFirst(Comparator.naturalOrder()));

    private final Map<String, WorkerRegistration> workers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration heartbeatTimeout;
    private final Duration removalThreshold;

    public WorkerRegistry(Clock clock, Duration heartbeatTimeout, Duration removalThreshold) {
        this.clock = clock;
        this.heartbeatTimeout = heartbeatTimeout;
        this.removalThreshold = removalThreshold;
    }

    /**
     * Register or re-register a worker. Re-registration replaces the previous
     * entry and starts the worker out idle.
     */
    public synchronized WorkerRegistration register(
            String workerId,
            OperationType workerType,
            String endpointUrl,
            WorkerCapabilities capabilities) {
        WorkerRegistration registration = WorkerRegistration.create(
            workerId, workerType, endpointUrl, capabilities, clock.instant());
        WorkerRegistration previous = workers.put(workerId, registration);

        if (previous != null && previous.currentOperationId() != null) {
            log.info("Worker {} re-registered while assigned to {}", workerId, previous.currentOperationId());
        } else {
            log.info("Registered {} worker {} at {} (gpu={})",
                workerType, workerId, endpointUrl, registration.capabilities().gpu());
        }
        return registration;
    }

    /**
     * Record a heartbeat.
     *
     * @throws NotFoundException if the worker is not registered (it should re-register)
     */
    public synchronized WorkerRegistration heartbeat(String workerId) {
        WorkerRegistration current = require(workerId);
        WorkerRegistration updated = current.withHeartbeat(clock.instant());
        workers.put(workerId, updated);
        return updated;
    }

    /**
     * Pick an idle worker of the given type and mark it busy with the operation.
     */
    public synchronized Optional<WorkerRegistration> selectAndMarkBusy(OperationType workerType, String operationId) {
        Instant now = clock.instant();
        Optional<WorkerRegistration> selected = workers.values().stream()
            .filter(w -> w.workerType() == workerType)
            .filter(WorkerRegistration::isAvailable)
            .filter(w -> !w.isStale(now, heartbeatTimeout))
            .min(LEAST_RECENTLY_SELECTED.thenComparing(WorkerRegistration::workerId));

        selected.ifPresent(w -> {
            workers.put(w.workerId(), w.withBusy(operationId, now));
            log.debug("Selected worker {} for operation {}", w.workerId(), operationId);
        });
        return selected.map(w -> workers.get(w.workerId()));
    }

    /**
     * Free the worker currently assigned to an operation, if any.
     */
    public synchronized Optional<WorkerRegistration> releaseOperation(String operationId) {
        Optional<WorkerRegistration> owner = findByOperation(operationId);
        owner.ifPresent(w -> {
            workers.put(w.workerId(), w.withIdle());
            log.debug("Released worker {} from operation {}", w.workerId(), operationId);
        });
        return owner;
    }

    public Optional<WorkerRegistration> find(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    public Optional<WorkerRegistration> findByOperation(String operationId) {
        return workers.values().stream()
            .filter(w -> operationId.equals(w.currentOperationId()))
            .findFirst();
    }

    public List<WorkerRegistration> list() {
        return workers.values().stream()
            .sorted(Comparator.comparing(WorkerRegistration::workerId))
            .toList();
    }

    public List<WorkerRegistration> list(OperationType workerType) {
        return list().stream().filter(w -> w.workerType() == workerType).toList();
    }

    public long countByStatus(WorkerStatus status) {
        return workers.values().stream().filter(w -> w.status() == status).count();
    }

    /**
     * Mark workers that missed their heartbeat window as unreachable.
     *
     * @return Workers newly marked unreachable
     */
    public synchronized List<WorkerRegistration> markStaleWorkers() {
        Instant now = clock.instant();
        List<WorkerRegistration> stale = new ArrayList<>();
        for (WorkerRegistration worker : workers.values()) {
            if (worker.status() != WorkerStatus.UNREACHABLE && worker.isStale(now, heartbeatTimeout)) {
                WorkerRegistration unreachable = worker.withUnreachable();
                workers.put(worker.workerId(), unreachable);
                stale.add(unreachable);
                log.warn("Worker {} missed heartbeats since {}", worker.workerId(), worker.lastHeartbeatAt());
            }
        }
        return stale;
    }

    /**
     * Remove workers silent for longer than the removal threshold.
     *
     * @return Removed workers
     */
    public synchronized List<WorkerRegistration> removeDeadWorkers() {
        Instant now = clock.instant();
        List<WorkerRegistration> dead = workers.values().stream()
            .filter(w -> w.isStale(now, removalThreshold))
            .toList();
        dead.forEach(w -> {
            workers.remove(w.workerId());
            log.info("Removed worker {} after {} without heartbeat", w.workerId(), removalThreshold);
        });
        return dead;
    }

    public boolean unregister(String workerId) {
        return workers.remove(workerId) != null;
    }

    public Duration heartbeatTimeout() {
        return heartbeatTimeout;
    }

    private WorkerRegistration require(String workerId) {
        WorkerRegistration worker = workers.get(workerId);
        if (worker == null) {
            throw new NotFoundException("Worker", workerId);
        }
        return worker;
    }
}
