package com.conveyor.orchestrator.workspace;

public enum LockType {
    /** Workspace create and cleanup. Excludes every other grant. */
    EXCLUSIVE,
    /** Step execution. Coexists with other SHARED grants. */
    SHARED
}
