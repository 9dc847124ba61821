package com.quantops.core.progress;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable copy of the latest state written to a {@link ProgressBridge}.
 */
public record ProgressSnapshot(
    double percentage,
    String message,
    Map<String, Object> fields,
    Instant timestamp
) {
    public ProgressSnapshot {
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static ProgressSnapshot initial() {
        return new ProgressSnapshot(0.0, null, Map.of(), null);
    }
}
