package com.conveyor.orchestrator.api.dto;

import com.conveyor.orchestrator.model.StepExecution;
import com.conveyor.orchestrator.model.StepRun;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for GET /api/pipeline-runs/{id}/steps.
 * {@code attempts} lists every execution attempt in attempt order.
 */
public record StepRunResponse(
        UUID                        id,
        int                         stepIndex,
        String                      name,
        String                      kind,
        String                      status,
        String                      onSuccess,
        String                      onFailure,
        String                      error,
        Instant                     startedAt,
        Instant                     completedAt,
        List<StepExecutionResponse> attempts
) {
    public static StepRunResponse from(StepRun step, List<StepExecution> executions) {
        return new StepRunResponse(
                step.getId(),
                step.getStepIndex(),
                step.getName(),
                step.getKind().name(),
                step.getStatus().name(),
                step.getOnSuccess(),
                step.getOnFailure(),
                step.getError(),
                step.getStartedAt(),
                step.getCompletedAt(),
                executions.stream()
                        .filter(e -> e.getStepRunId().equals(step.getId()))
                        .map(StepExecutionResponse::from)
                        .toList()
        );
    }
}
