package com.quantops.agent;

import com.quantops.worker.DomainException;
import com.quantops.worker.ErrorKind;

/**
 * The child operation of a research phase failed.
 */
public class PhaseFailedException extends DomainException {

    private final ResearchPhase phase;
    private final String childOperationId;

    public PhaseFailedException(ResearchPhase phase, String childOperationId, String childError) {
        super(ErrorKind.PHASE_FAILED, String.format("Phase %s failed (operation %s): %s",
            phase.wireName(), childOperationId, childError));
        this.phase = phase;
        this.childOperationId = childOperationId;
    }

    /**
     * The phase's child operation could not be dispatched or resumed.
     */
    public PhaseFailedException(ResearchPhase phase, String message, Throwable cause) {
        super(ErrorKind.PHASE_FAILED, String.format("Phase %s failed: %s", phase.wireName(), message), cause);
        this.phase = phase;
        this.childOperationId = null;
    }

    public ResearchPhase getPhase() {
        return phase;
    }

    public String getChildOperationId() {
        return childOperationId;
    }
}
