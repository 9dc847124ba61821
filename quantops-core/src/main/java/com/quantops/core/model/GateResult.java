package com.quantops.core.model;

/**
 * Outcome of a quality gate evaluation.
 */
public record GateResult(boolean passed, String reason) {

    public static GateResult pass() {
        return new GateResult(true, "passed");
    }

    public static GateResult fail(String reason) {
        return new GateResult(false, reason);
    }
}
