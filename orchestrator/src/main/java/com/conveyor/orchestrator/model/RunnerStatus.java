package com.conveyor.orchestrator.model;

/**
 * IDLE runners may be handed work; BUSY runners hold one step execution.
 * DEAD means the heartbeat lapsed; OFFLINE means the runner disconnected cleanly.
 */
public enum RunnerStatus {
    IDLE,
    BUSY,
    DEAD,
    OFFLINE;

    public boolean isAlive() {
        return this == IDLE || this == BUSY;
    }
}
