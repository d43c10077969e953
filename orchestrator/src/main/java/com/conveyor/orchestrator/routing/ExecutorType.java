package com.conveyor.orchestrator.routing;

public enum ExecutorType {
    /** A container spawned by this backend through the local driver. */
    LOCAL,
    /** A registered remote runner. */
    REMOTE
}
