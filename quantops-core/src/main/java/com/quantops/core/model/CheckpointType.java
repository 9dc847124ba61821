package com.quantops.core.model;

import java.util.Arrays;

/**
 * Reason a checkpoint was written.
 */
public enum CheckpointType {
    PERIODIC,
    CANCELLATION,
    FAILURE,
    SHUTDOWN;

    /**
     * Lower-case name used in persisted rows and API payloads.
     */
    public String wireName() {
        return name().toLowerCase();
    }

    public static CheckpointType fromWireName(String value) {
        return Arrays.stream(values())
            .filter(t -> t.wireName().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown checkpoint type: " + value));
    }
}
