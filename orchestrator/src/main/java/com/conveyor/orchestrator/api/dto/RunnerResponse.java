package com.conveyor.orchestrator.api.dto;

import com.conveyor.orchestrator.model.Runner;
import com.conveyor.orchestrator.routing.RunnerLabels;

import java.time.Instant;
import java.util.UUID;

public record RunnerResponse(
        String       id,
        String       name,
        String       runnerType,
        RunnerLabels labels,
        String       status,
        UUID         currentStepExecutionId,
        Instant      lastHeartbeatAt,
        Instant      registeredAt,
        Instant      connectedAt
) {
    public static RunnerResponse from(Runner r, RunnerLabels labels) {
        return new RunnerResponse(
                r.getId(),
                r.getName(),
                r.getRunnerType(),
                labels,
                r.getStatus().name(),
                r.getCurrentStepExecutionId(),
                r.getLastHeartbeatAt(),
                r.getRegisteredAt(),
                r.getConnectedAt()
        );
    }
}
