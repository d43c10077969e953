package com.conveyor.orchestrator.api.dto;

import com.conveyor.orchestrator.model.StepExecution;

import java.time.Instant;
import java.util.UUID;

public record StepExecutionResponse(
        UUID    id,
        String  executionKey,
        int     attempt,
        String  status,
        String  executorType,
        String  runnerId,
        Integer exitCode,
        String  error,
        Instant startedAt,
        Instant completedAt
) {
    public static StepExecutionResponse from(StepExecution e) {
        return new StepExecutionResponse(
                e.getId(),
                e.getExecutionKey(),
                e.getAttempt(),
                e.getStatus().name(),
                e.getExecutorType(),
                e.getRunnerId(),
                e.getExitCode(),
                e.getError(),
                e.getStartedAt(),
                e.getCompletedAt()
        );
    }
}
