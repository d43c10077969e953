package com.conveyor.orchestrator.statemachine;

/** Lifecycle of a run's shared workspace volume. Only CLEANED is terminal. */
public enum WorkspaceState {
    CREATING,
    READY,
    IN_USE,
    CLEANING,
    CLEANED,
    FAILED
}
