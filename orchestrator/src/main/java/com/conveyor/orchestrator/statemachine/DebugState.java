package com.conveyor.orchestrator.statemachine;

/** Lifecycle of an interactive debug session. TIMEOUT and ENDED are terminal. */
public enum DebugState {
    PENDING,
    WAITING_AT_BP,
    CONNECTED,
    TIMEOUT,
    ENDED
}
