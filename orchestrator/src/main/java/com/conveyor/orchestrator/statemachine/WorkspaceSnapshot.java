package com.conveyor.orchestrator.statemachine;

import java.time.Instant;
import java.util.List;

/** Serializable form of a {@link WorkspaceStateMachine}. */
public record WorkspaceSnapshot(
        WorkspaceState state,
        int useCount,
        Instant lastActivityAt,
        List<StateTransition<WorkspaceState>> history
) {}
