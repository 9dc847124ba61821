package com.quantops.core.progress;

import com.quantops.core.model.OperationProgress;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hand-off point between an execution thread and the threads that read its progress.
 *
 * The producer overwrites a single snapshot and appends to an ordered metric log;
 * consumers copy the snapshot or read the log incrementally with a cursor.
 * One lock guards both and is held only for the copy or append, so producer
 * writes never wait on I/O.
 *
 * Usage:
 * <pre>
 * bridge.writeState(42.0, "Epoch 42/100", Map.of("current_step", "epoch 42"));
 * bridge.appendMetric(Map.of("epoch", 42, "loss", 0.31));
 *
 * MetricsPage page = bridge.readMetrics(lastCursor);
 * lastCursor = page.cursor();
 * </pre>
 */
public class ProgressBridge {

    public static final String CURRENT_STEP = "current_step";
    public static final String STEPS_COMPLETED = "steps_completed";
    public static final String STEPS_TOTAL = "steps_total";

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final List<Map<String, Object>> metrics = new ArrayList<>();
    private ProgressSnapshot snapshot = ProgressSnapshot.initial();

    public ProgressBridge() {
        this(Clock.systemUTC());
    }

    public ProgressBridge(Clock clock) {
        this.clock = clock;
    }

    /**
     * Replace the whole snapshot and stamp it with the current time.
     */
    public void writeState(double percentage, String message, Map<String, Object> fields) {
        ProgressSnapshot next = new ProgressSnapshot(percentage, message, fields, clock.instant());
        lock.lock();
        try {
            snapshot = next;
        } finally {
            lock.unlock();
        }
    }

    public void writeState(double percentage, String message) {
        writeState(percentage, message, Map.of());
    }

    /**
     * Append one metric record to the log.
     */
    public void appendMetric(Map<String, Object> record) {
        Map<String, Object> copy = Collections.unmodifiableMap(new LinkedHashMap<>(record));
        lock.lock();
        try {
            metrics.add(copy);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of the latest snapshot.
     */
    public ProgressSnapshot readState() {
        lock.lock();
        try {
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records appended at or after {@code cursor}. A negative cursor reads from
     * the start; a cursor past the end yields an empty page at the end.
     */
    public MetricsPage readMetrics(int cursor) {
        lock.lock();
        try {
            int from = Math.min(Math.max(cursor, 0), metrics.size());
            return new MetricsPage(new ArrayList<>(metrics.subList(from, metrics.size())), metrics.size());
        } finally {
            lock.unlock();
        }
    }

    public int metricCount() {
        lock.lock();
        try {
            return metrics.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Convert the latest snapshot into the progress shape stored on an operation.
     */
    public OperationProgress toOperationProgress() {
        return toOperationProgress(readState());
    }

    public static OperationProgress toOperationProgress(ProgressSnapshot snapshot) {
        Map<String, Object> context = new LinkedHashMap<>(snapshot.fields());
        Object step = context.remove(CURRENT_STEP);
        int completed = asInt(context.remove(STEPS_COMPLETED));
        int total = asInt(context.remove(STEPS_TOTAL));
        Instant updatedAt = snapshot.timestamp();
        return new OperationProgress(
            snapshot.percentage(),
            snapshot.message(),
            step != null ? step.toString() : null,
            completed,
            total,
            context,
            updatedAt
        );
    }

    private static int asInt(Object value) {
        return value instanceof Number ? ((Number) value).intValue() : 0;
    }
}
