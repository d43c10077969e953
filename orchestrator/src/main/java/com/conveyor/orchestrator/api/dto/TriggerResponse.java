package com.conveyor.orchestrator.api.dto;

import com.conveyor.orchestrator.service.TriggerOutcome;

import java.util.UUID;

/**
 * Response body for POST /api/pipeline-runs.
 *
 * An admitted trigger carries the new run. A duplicate carries the run the
 * original trigger started instead, and no new run.
 */
public record TriggerResponse(
        boolean             duplicate,
        UUID                originalRunId,
        String              reason,
        PipelineRunResponse run
) {
    public static TriggerResponse from(TriggerOutcome outcome) {
        if (outcome.isDuplicate()) {
            return new TriggerResponse(true, outcome.check().originalRunId(), outcome.check().reason(), null);
        }
        return new TriggerResponse(false, null, outcome.check().reason(), PipelineRunResponse.from(outcome.run()));
    }
}
