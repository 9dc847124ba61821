package com.quantops.agent;

import com.quantops.worker.DomainException;
import com.quantops.worker.ErrorKind;

/**
 * A quality gate rejected the result of a phase. The phase's own operation
 * stays COMPLETED; the research cycle fails with the gate reason.
 */
public class GateFailedException extends DomainException {

    private final ResearchPhase phase;
    private final String reason;

    public GateFailedException(ResearchPhase phase, String gate, String reason) {
        super(ErrorKind.QUALITY_GATE, capitalize(gate) + " gate failed: " + reason);
        this.phase = phase;
        this.reason = reason;
    }

    public ResearchPhase getPhase() {
        return phase;
    }

    public String getReason() {
        return reason;
    }

    private static String capitalize(String gate) {
        return Character.toUpperCase(gate.charAt(0)) + gate.substring(1);
    }
}
