package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.execution.ExecutionConfig;

import java.util.UUID;

/** A step execution handed to the local worker pool. */
public record LocalJob(
        UUID stepExecutionId,
        UUID pipelineRunId,
        int stepIndex,
        String workspaceId,
        ExecutionConfig config
) {}
