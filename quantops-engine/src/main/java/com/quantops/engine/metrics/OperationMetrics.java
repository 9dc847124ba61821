package com.quantops.engine.metrics;

import com.quantops.core.model.CheckpointType;
import com.quantops.core.model.OperationType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Micrometer metrics for operation lifecycle, checkpoints and gates.
 *
 * Metrics exposed:
 * - Operation counts by type and outcome
 * - Active operations gauge
 * - Resume attempts and conflicts
 * - Checkpoint saves by type and save latency
 * - Gate failures by gate
 */
public class OperationMetrics implements MeterBinder {

    // Metric names
    public static final String OPERATIONS_CREATED = "quantops.operations.created";
    public static final String OPERATIONS_COMPLETED = "quantops.operations.completed";
    public static final String OPERATIONS_FAILED = "quantops.operations.failed";
    public static final String OPERATIONS_CANCELLED = "quantops.operations.cancelled";
    public static final String OPERATIONS_ACTIVE = "quantops.operations.active";

    public static final String OPERATION_FAILURES = "quantops.operations.failures";

    public static final String RESUMES = "quantops.operations.resumes";
    public static final String RESUME_CONFLICTS = "quantops.operations.resume.conflicts";

    public static final String CHECKPOINT_SAVES = "quantops.checkpoints.saved";
    public static final String CHECKPOINT_SAVE_DURATION = "quantops.checkpoints.save.duration";

    public static final String GATE_FAILURES = "quantops.gates.failed";
    public static final String ORPHANS_RECOVERED = "quantops.recovery.orphans";

    private final MeterRegistry registry;
    private final AtomicReference<Supplier<Number>> activeOperations =
        new AtomicReference<>(() -> 0);

    public OperationMetrics(MeterRegistry registry) {
        this.registry = registry;
        bindTo(registry);
    }

    /**
     * Metrics backed by a private registry, for tests and standalone use.
     */
    public static OperationMetrics noop() {
        return new OperationMetrics(new SimpleMeterRegistry());
    }

    @Override
    public void bindTo(MeterRegistry meterRegistry) {
        Gauge.builder(OPERATIONS_ACTIVE, activeOperations, ref -> ref.get().get().doubleValue())
            .description("Operations in PENDING, RUNNING or RESUMING")
            .register(meterRegistry);
    }

    /**
     * Source for the active operations gauge.
     */
    public void trackActiveOperations(Supplier<Number> supplier) {
        activeOperations.set(supplier);
    }

    // ========== Lifecycle Metrics ==========

    public void operationCreated(OperationType type) {
        counter(OPERATIONS_CREATED, "Total operations created", type).increment();
    }

    public void operationCompleted(OperationType type) {
        counter(OPERATIONS_COMPLETED, "Total operations completed successfully", type).increment();
    }

    public void operationFailed(OperationType type) {
        counter(OPERATIONS_FAILED, "Total operations failed", type).increment();
    }

    public void operationCancelled(OperationType type) {
        counter(OPERATIONS_CANCELLED, "Total operations cancelled", type).increment();
    }

    /**
     * Domain failure raised by an operation function, tagged with its error kind.
     */
    public void domainFailure(OperationType type, String kind) {
        Counter.builder(OPERATION_FAILURES)
            .tag("type", type.name().toLowerCase())
            .tag("kind", kind)
            .description("Operation function failures by error kind")
            .register(registry)
            .increment();
    }

    public void operationResumed(OperationType type) {
        counter(RESUMES, "Total successful resume transitions", type).increment();
    }

    public void resumeConflict(OperationType type) {
        counter(RESUME_CONFLICTS, "Resume requests that lost the conditional update", type).increment();
    }

    // ========== Checkpoint Metrics ==========

    public void checkpointSaved(CheckpointType type, Duration duration) {
        Counter.builder(CHECKPOINT_SAVES)
            .tag("type", type.wireName())
            .description("Total checkpoints written")
            .register(registry)
            .increment();

        Timer.builder(CHECKPOINT_SAVE_DURATION)
            .tag("type", type.wireName())
            .description("Checkpoint save latency")
            .register(registry)
            .record(duration);
    }

    // ========== Gate & Recovery Metrics ==========

    public void gateFailed(String gate) {
        Counter.builder(GATE_FAILURES)
            .tag("gate", gate)
            .description("Quality gate failures")
            .register(registry)
            .increment();
    }

    public void orphanRecovered(OperationType type) {
        counter(ORPHANS_RECOVERED, "Orphaned operations marked failed", type).increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Counter counter(String name, String description, OperationType type) {
        return Counter.builder(name)
            .tag("type", type.name().toLowerCase())
            .description(description)
            .register(registry);
    }
}
