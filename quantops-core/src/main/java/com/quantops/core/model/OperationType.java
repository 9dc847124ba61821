package com.quantops.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of long-running operations. Each type maps to the worker kind used in
 * HTTP paths ({@code /training/start}, {@code /research/resume}, ...).
 */
public enum OperationType {
    TRAINING("training"),
    BACKTESTING("backtesting"),
    AGENT_RESEARCH("research"),
    AGENT_DESIGN("design"),
    AGENT_ASSESSMENT("assessment");

    private final String kind;

    OperationType(String kind) {
        this.kind = kind;
    }

    public String kind() {
        return kind;
    }

    /**
     * Resolve a worker kind path segment to an operation type.
     */
    public static Optional<OperationType> fromKind(String kind) {
        return Arrays.stream(values())
            .filter(t -> t.kind.equalsIgnoreCase(kind))
            .findFirst();
    }
}
