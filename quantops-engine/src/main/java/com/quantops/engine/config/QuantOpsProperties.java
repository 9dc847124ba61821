package com.quantops.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Orchestration settings bound from {@code quantops.*}.
 *
 * <pre>
 * quantops:
 *   persistence: jdbc
 *   checkpoint:
 *     artifacts-dir: /var/lib/quantops/checkpoints
 *     unit-interval: 10
 *     time-interval: 5m
 *   workers:
 *     heartbeat-timeout: 90s
 *     local-slots: 2
 * </pre>
 */
@ConfigurationProperties(prefix = "quantops")
public record QuantOpsProperties(
    @DefaultValue("memory") Persistence persistence,
    @DefaultValue Checkpoint checkpoint,
    @DefaultValue Workers workers,
    @DefaultValue Recovery recovery
) {

    public enum Persistence {
        MEMORY,
        JDBC
    }

    /**
     * Periodic checkpoint cadence and artifact storage.
     */
    public record Checkpoint(
        @DefaultValue("./data/checkpoints") String artifactsDir,
        @DefaultValue("10") int unitInterval,
        @DefaultValue("5m") Duration timeInterval,
        @DefaultValue("30s") Duration saveTimeout
    ) {}

    /**
     * Worker liveness thresholds and in-process worker slots per operation type.
     */
    public record Workers(
        @DefaultValue("90s") Duration heartbeatTimeout,
        @DefaultValue("5m") Duration removalThreshold,
        @DefaultValue("1") int localSlots,
        @DefaultValue("30s") Duration shutdownTimeout
    ) {}

    /**
     * Reconciliation sweep cadence and finished-operation retention.
     */
    public record Recovery(
        @DefaultValue("30s") Duration sweepInterval,
        @DefaultValue("2m") Duration orphanGracePeriod,
        @DefaultValue("7d") Duration retention
    ) {}
}
