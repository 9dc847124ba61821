package com.quantops.core.model;

/**
 * Lifecycle states for an operation.
 * Transitions follow a strict state machine, checked by {@link #canTransitionTo}.
 */
public enum OperationStatus {
    /**
     * Operation recorded but not yet running.
     * Transitions: -> RUNNING, FAILED (pre-flight failure), CANCELLED
     */
    PENDING,

    /**
     * Domain function executing on a worker.
     * Transitions: -> COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Finished successfully. Terminal state, never resumable.
     */
    COMPLETED,

    /**
     * Finished with an error or orphaned by a crashed worker.
     * Transitions: -> RESUMING
     */
    FAILED,

    /**
     * Stopped by an operator or by shutdown.
     * Transitions: -> RESUMING
     */
    CANCELLED,

    /**
     * A resume request won the conditional update and is reconstructing state.
     * Transitions: -> RUNNING, FAILED, CANCELLED
     */
    RESUMING;

    /**
     * Check if this state is terminal for the current run.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if an operation in this state may be resumed from its checkpoint.
     */
    public boolean isResumable() {
        return this == FAILED || this == CANCELLED;
    }

    /**
     * Check if this state counts towards the active operation total.
     */
    public boolean isActive() {
        return this == PENDING || this == RUNNING || this == RESUMING;
    }

    /**
     * Check if an operation in this state may still be cancelled.
     */
    public boolean isCancellable() {
        return this == PENDING || this == RUNNING || this == RESUMING;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(OperationStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == FAILED || target == CANCELLED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED -> false;
            case FAILED, CANCELLED -> target == RESUMING;
            case RESUMING -> target == RUNNING || target == FAILED || target == CANCELLED;
        };
    }
}
