package com.quantops.core.checkpoint;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides when an execution loop should write a periodic checkpoint.
 *
 * A checkpoint is due at every positive multiple of {@code unitInterval}
 * (epochs, bars, phases), or once {@code timeInterval} has elapsed since the
 * last recorded checkpoint, whichever comes first. Used from a single
 * execution thread.
 */
public class CheckpointPolicy {

    private final int unitInterval;
    private final Duration timeInterval;
    private final Clock clock;

    private Instant lastCheckpointAt;
    private int lastCheckpointUnit = -1;

    public CheckpointPolicy(int unitInterval, Duration timeInterval) {
        this(unitInterval, timeInterval, Clock.systemUTC());
    }

    public CheckpointPolicy(int unitInterval, Duration timeInterval, Clock clock) {
        if (unitInterval <= 0) {
            throw new IllegalArgumentException("unitInterval must be positive, got " + unitInterval);
        }
        if (timeInterval == null || timeInterval.isZero() || timeInterval.isNegative()) {
            throw new IllegalArgumentException("timeInterval must be positive, got " + timeInterval);
        }
        this.unitInterval = unitInterval;
        this.timeInterval = timeInterval;
        this.clock = clock;
        this.lastCheckpointAt = clock.instant();
    }

    /**
     * Check whether a checkpoint is due after completing {@code unitIndex} units.
     */
    public boolean shouldCheckpoint(int unitIndex) {
        if (unitIndex <= 0) {
            return false;
        }
        if (unitIndex % unitInterval == 0) {
            return true;
        }
        return !timeSinceLastCheckpoint().minus(timeInterval).isNegative();
    }

    /**
     * Record that a checkpoint was written after {@code unitIndex} units.
     */
    public void recordCheckpoint(int unitIndex) {
        this.lastCheckpointUnit = unitIndex;
        this.lastCheckpointAt = clock.instant();
    }

    public Duration timeSinceLastCheckpoint() {
        return Duration.between(lastCheckpointAt, clock.instant());
    }

    /**
     * Unit index of the last recorded checkpoint, or -1 if none.
     */
    public int lastCheckpointUnit() {
        return lastCheckpointUnit;
    }

    public int unitInterval() {
        return unitInterval;
    }

    public Duration timeInterval() {
        return timeInterval;
    }
}
