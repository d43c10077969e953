package com.conveyor.orchestrator.statemachine;

/**
 * Lifecycle of one execution attempt. CANCELLED is reachable from every
 * non-terminal state; COMPLETED only through COMPLETING with exit code 0.
 */
public enum StepExecutionState {
    PENDING,
    PREPARING,
    RUNNING,
    COMPLETING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /** PREPARING or RUNNING: the execution holds a runner or a container. */
    public boolean isActive() {
        return this == PREPARING || this == RUNNING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
