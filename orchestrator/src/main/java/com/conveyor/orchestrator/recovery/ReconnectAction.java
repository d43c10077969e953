package com.conveyor.orchestrator.recovery;

/** What a reconnecting runner should do with the step it remembers. */
public enum ReconnectAction {
    /** The step is still assigned to this runner; keep going. */
    CONTINUE,
    /** The step was reassigned or settled while the runner was away; drop it. */
    ABORT,
    /** The runner held nothing; it is free for new work. */
    IDLE;

    public String wireName() {
        return name().toLowerCase();
    }
}
