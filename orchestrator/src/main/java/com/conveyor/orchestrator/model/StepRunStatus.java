package com.conveyor.orchestrator.model;

/**
 * Coarse progress of one step in a run. The per-attempt lifecycle lives on
 * {@link StepExecution}.
 */
public enum StepRunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
