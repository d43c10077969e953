package com.conveyor.orchestrator.event;

import com.conveyor.orchestrator.execution.StepPolicy;

import java.util.UUID;

/**
 * A merge or trigger action fired by a step's on_success / on_failure policy.
 * Handled by the source-control and trigger collaborators.
 */
public record StepActionEvent(UUID pipelineRunId, int stepIndex, StepPolicy policy, boolean stepSucceeded) {}
