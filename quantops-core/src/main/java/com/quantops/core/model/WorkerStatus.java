package com.quantops.core.model;

/**
 * Availability of a registered worker.
 */
public enum WorkerStatus {
    IDLE,
    BUSY,
    UNREACHABLE
}
