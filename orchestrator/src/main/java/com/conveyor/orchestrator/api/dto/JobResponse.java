package com.conveyor.orchestrator.api.dto;

import com.conveyor.orchestrator.execution.ExecutionConfig;
import com.conveyor.orchestrator.runner.QueuedJob;

import java.util.UUID;

/**
 * Response body for GET /api/runners/{id}/job: the same payload an
 * execute_step message carries over the websocket.
 */
public record JobResponse(
        UUID            stepId,
        String          executionKey,
        UUID            pipelineRunId,
        int             stepIndex,
        String          stepName,
        ExecutionConfig config
) {
    public static JobResponse from(QueuedJob job) {
        return new JobResponse(
                job.stepExecutionId(),
                job.executionKey(),
                job.pipelineRunId(),
                job.stepIndex(),
                job.stepName(),
                job.config()
        );
    }
}
