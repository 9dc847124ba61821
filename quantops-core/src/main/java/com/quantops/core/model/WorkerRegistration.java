package com.quantops.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;
import java.time.Instant;

/**
 * A worker process known to the orchestrator. Ephemeral: lost on orchestrator
 * restart and re-created when the worker re-registers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkerRegistration(
    String workerId,
    OperationType workerType,
    String endpointUrl,
    WorkerCapabilities capabilities,
    WorkerStatus status,
    String currentOperationId,
    Instant registeredAt,
    Instant lastHeartbeatAt,
    Instant lastSelectedAt
) {
    public static WorkerRegistration create(
            String workerId,
            OperationType workerType,
            String endpointUrl,
            WorkerCapabilities capabilities,
            Instant now) {
        return new WorkerRegistration(
            workerId,
            workerType,
            endpointUrl,
            capabilities != null ? capabilities : WorkerCapabilities.cpuOnly(),
            WorkerStatus.IDLE,
            null,
            now,
            now,
            null
        );
    }

    public static final String IN_PROCESS_SCHEME = "local://";

    /**
     * Workers hosted inside the orchestrator process need no heartbeats.
     */
    @JsonIgnore
    public boolean isInProcess() {
        return endpointUrl != null && endpointUrl.startsWith(IN_PROCESS_SCHEME);
    }

    @JsonIgnore
    public boolean isAvailable() {
        return status == WorkerStatus.IDLE;
    }

    /**
     * Check whether the worker missed its heartbeat window.
     */
    public boolean isStale(Instant now, Duration heartbeatTimeout) {
        return !isInProcess() && lastHeartbeatAt.plus(heartbeatTimeout).isBefore(now);
    }

    public WorkerRegistration withHeartbeat(Instant now) {
        WorkerStatus newStatus = status == WorkerStatus.UNREACHABLE
            ? (currentOperationId != null ? WorkerStatus.BUSY : WorkerStatus.IDLE)
            : status;
        return new WorkerRegistration(
            workerId, workerType, endpointUrl, capabilities, newStatus,
            currentOperationId, registeredAt, now, lastSelectedAt
        );
    }

    public WorkerRegistration withBusy(String operationId, Instant now) {
        return new WorkerRegistration(
            workerId, workerType, endpointUrl, capabilities, WorkerStatus.BUSY,
            operationId, registeredAt, lastHeartbeatAt, now
        );
    }

    public WorkerRegistration withIdle() {
        WorkerStatus newStatus = status == WorkerStatus.UNREACHABLE ? WorkerStatus.UNREACHABLE : WorkerStatus.IDLE;
        return new WorkerRegistration(
            workerId, workerType, endpointUrl, capabilities, newStatus,
            null, registeredAt, lastHeartbeatAt, lastSelectedAt
        );
    }

    public WorkerRegistration withUnreachable() {
        return new WorkerRegistration(
            workerId, workerType, endpointUrl, capabilities, WorkerStatus.UNREACHABLE,
            currentOperationId, registeredAt, lastHeartbeatAt, lastSelectedAt
        );
    }
}
