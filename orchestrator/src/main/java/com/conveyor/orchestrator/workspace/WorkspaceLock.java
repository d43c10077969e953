package com.conveyor.orchestrator.workspace;

import java.time.Instant;
import java.util.UUID;

/**
 * Result of a lock request. When {@code acquired} is false the request timed
 * out and nothing is held; releasing such a lock is a no-op.
 */
public record WorkspaceLock(
        UUID id,
        String workspaceId,
        LockType type,
        String reason,
        Instant acquiredAt,
        boolean acquired
) {}
