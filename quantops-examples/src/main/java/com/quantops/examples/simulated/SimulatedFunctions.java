package com.quantops.examples.simulated;

import com.quantops.core.model.OperationType;
import com.quantops.worker.OperationFunction;

/**
 * Simulated function for each leaf operation type.
 */
public final class SimulatedFunctions {

    private SimulatedFunctions() {
    }

    /**
     * @throws IllegalArgumentException for {@link OperationType#AGENT_RESEARCH}, which
     *                                  needs an orchestrator and is wired separately
     */
    public static OperationFunction forType(OperationType type) {
        return switch (type) {
            case TRAINING -> new SimulatedTraining();
            case BACKTESTING -> new SimulatedBacktest();
            case AGENT_DESIGN -> new SimulatedDesign();
            case AGENT_ASSESSMENT -> new SimulatedAssessment();
            case AGENT_RESEARCH -> throw new IllegalArgumentException("No simulated function for " + type);
        };
    }
}
