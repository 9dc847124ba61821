package com.quantops.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Latest progress snapshot recorded on an operation.
 * Overwritten on every pull; never appended.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OperationProgress(
    double percentage,
    String message,
    String currentStep,
    int stepsCompleted,
    int stepsTotal,
    Map<String, Object> context,
    Instant updatedAt
) {
    public OperationProgress {
        percentage = Math.max(0.0, Math.min(100.0, percentage));
        context = context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /**
     * Progress of an operation that has not reported anything yet.
     */
    public static OperationProgress empty() {
        return new OperationProgress(0.0, null, null, 0, 0, Map.of(), null);
    }

    public static OperationProgress of(double percentage, String message, Instant updatedAt) {
        return new OperationProgress(percentage, message, null, 0, 0, Map.of(), updatedAt);
    }
}
