package com.conveyor.orchestrator.workspace;

import java.time.Duration;

/** A scoped lock could not be acquired within its timeout. */
public class LockTimeoutException extends RuntimeException {

    public LockTimeoutException(String workspaceId, LockType type, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + "ms waiting for "
                + type + " lock on workspace " + workspaceId);
    }
}
