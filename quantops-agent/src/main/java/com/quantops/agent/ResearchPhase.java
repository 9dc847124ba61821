package com.quantops.agent;

import com.quantops.core.model.OperationType;

import java.util.Arrays;

/**
 * Phases of a research cycle, in execution order.
 */
public enum ResearchPhase {
    IDLE("idle", null, null),
    DESIGNING("designing", OperationType.AGENT_DESIGN, "design_op_id"),
    TRAINING("training", OperationType.TRAINING, "training_op_id"),
    BACKTESTING("backtesting", OperationType.BACKTESTING, "backtest_op_id"),
    ASSESSING("assessing", OperationType.AGENT_ASSESSMENT, "assessment_op_id"),
    DONE("done", null, null);

    private final String wireName;
    private final OperationType childType;
    private final String childKey;

    ResearchPhase(String wireName, OperationType childType, String childKey) {
        this.wireName = wireName;
        this.childType = childType;
        this.childKey = childKey;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Operation type of the child launched for this phase, null for idle and done.
     */
    public OperationType childType() {
        return childType;
    }

    /**
     * State key holding the id of this phase's child operation.
     */
    public String childKey() {
        return childKey;
    }

    public boolean runsChild() {
        return childType != null;
    }

    public ResearchPhase next() {
        return this == DONE ? DONE : values()[ordinal() + 1];
    }

    /**
     * Number of phases finished before this one starts.
     */
    public int completedBefore() {
        return Math.max(0, ordinal() - 1);
    }

    public static ResearchPhase fromWireName(String name) {
        if (name == null) {
            return IDLE;
        }
        return Arrays.stream(values())
            .filter(p -> p.wireName.equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown research phase: " + name));
    }
}
