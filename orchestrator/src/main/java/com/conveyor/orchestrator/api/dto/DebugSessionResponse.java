package com.conveyor.orchestrator.api.dto;

import com.conveyor.orchestrator.model.DebugSession;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record DebugSessionResponse(
        UUID          id,
        UUID          pipelineRunId,
        UUID          originalRunId,
        String        status,
        List<Integer> breakpoints,
        Integer       currentStepIndex,
        String        currentStepName,
        String        commitSha,
        int           timeoutSeconds,
        Instant       createdAt,
        Instant       breakpointHitAt,
        Instant       expiresAt,
        Instant       endedAt
) {
    public static DebugSessionResponse from(DebugSession s, List<Integer> breakpoints) {
        return new DebugSessionResponse(
                s.getId(),
                s.getPipelineRunId(),
                s.getOriginalRunId(),
                s.getStatus().name(),
                breakpoints,
                s.getCurrentStepIndex(),
                s.getCurrentStepName(),
                s.getCommitSha(),
                s.getTimeoutSeconds(),
                s.getCreatedAt(),
                s.getBreakpointHitAt(),
                s.getExpiresAt(),
                s.getEndedAt()
        );
    }
}
