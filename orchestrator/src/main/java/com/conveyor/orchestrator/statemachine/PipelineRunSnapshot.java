package com.conveyor.orchestrator.statemachine;

import java.time.Instant;
import java.util.List;
import java.util.SortedSet;

/**
 * Serializable form of a {@link PipelineStateMachine}, including step
 * progress. Round-trips through Jackson without loss.
 */
public record PipelineRunSnapshot(
        PipelineRunState state,
        int totalSteps,
        SortedSet<Integer> completedSteps,
        Integer currentStepIndex,
        String currentStepName,
        Integer failedStepIndex,
        String failedStepName,
        String error,
        Instant startedAt,
        Instant completedAt,
        List<StateTransition<PipelineRunState>> history
) {}
