package com.conveyor.orchestrator.api.dto;

import com.conveyor.orchestrator.model.PipelineRun;

import java.time.Instant;
import java.util.UUID;

/** Response body for run endpoints. */
public record PipelineRunResponse(
        UUID    id,
        String  pipelineId,
        String  repoId,
        String  status,
        String  triggerType,
        String  triggerRef,
        int     stepsTotal,
        int     stepsCompleted,
        Integer currentStepIndex,
        String  currentStepName,
        Integer failedStepIndex,
        String  failedStepName,
        String  error,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {
    public static PipelineRunResponse from(PipelineRun run) {
        return new PipelineRunResponse(
                run.getId(),
                run.getPipelineId(),
                run.getRepoId(),
                run.getStatus().name(),
                run.getTriggerType(),
                run.getTriggerRef(),
                run.getStepsTotal(),
                run.getStepsCompleted(),
                run.getCurrentStepIndex(),
                run.getCurrentStepName(),
                run.getFailedStepIndex(),
                run.getFailedStepName(),
                run.getError(),
                run.getCreatedAt(),
                run.getStartedAt(),
                run.getCompletedAt()
        );
    }
}
