package com.conveyor.orchestrator.api.dto;

import com.conveyor.orchestrator.execution.StepDefinition;
import com.conveyor.orchestrator.service.TriggerRequest;

import java.util.List;

/**
 * Request body for POST /api/pipeline-runs.
 *
 * The pipeline definition travels with the trigger; pipelines themselves
 * are managed elsewhere.
 */
public record TriggerRunRequest(
        String               pipelineId,
        String               repoId,
        String               triggerType,
        String               triggerRef,
        List<StepDefinition> steps,
        boolean              force
) {
    public TriggerRequest toTriggerRequest() {
        return new TriggerRequest(pipelineId, repoId, triggerType, triggerRef, steps, force);
    }
}
