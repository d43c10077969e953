package com.conveyor.orchestrator.statemachine;

/**
 * Lifecycle of a pipeline run.
 *
 * Happy path: PENDING → PREPARING → RUNNING → COMPLETING → COMPLETED.
 * FAILED is reachable from PREPARING, RUNNING and COMPLETING; CANCELLED from
 * PENDING, PREPARING and RUNNING. COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum PipelineRunState {
    PENDING,
    PREPARING,
    RUNNING,
    COMPLETING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
