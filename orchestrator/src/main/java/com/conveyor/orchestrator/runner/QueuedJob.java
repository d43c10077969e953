package com.conveyor.orchestrator.runner;

import com.conveyor.orchestrator.execution.ExecutionConfig;
import com.conveyor.orchestrator.routing.StepRequirements;

import java.time.Instant;
import java.util.UUID;

/**
 * A remote step execution waiting for, or handed to, a runner.
 * Identified by its step execution id.
 */
public record QueuedJob(
        UUID stepExecutionId,
        UUID pipelineRunId,
        int stepIndex,
        String stepName,
        StepRequirements requirements,
        ExecutionConfig config,
        Instant enqueuedAt
) {
    public String executionKey() {
        return config.executionKey();
    }
}
