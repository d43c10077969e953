package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.execution.StepDefinition;
import com.conveyor.orchestrator.trigger.TriggerKey;

import java.util.List;

/**
 * Everything needed to start a pipeline run.
 *
 * @param triggerRef branch[:sha], card id or pipeline id, depending on the trigger type
 * @param force      start the run even if an identical trigger was admitted recently
 */
public record TriggerRequest(
        String pipelineId,
        String repoId,
        String triggerType,
        String triggerRef,
        List<StepDefinition> steps,
        boolean force
) {
    public TriggerRequest {
        if (pipelineId == null || pipelineId.isBlank()) {
            throw new IllegalArgumentException("pipelineId is required");
        }
        if (repoId == null || repoId.isBlank()) {
            throw new IllegalArgumentException("repoId is required");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Pipeline " + pipelineId + " has no steps");
        }
        triggerType = triggerType == null || triggerType.isBlank() ? TriggerKey.MANUAL : triggerType;
        triggerRef  = triggerRef == null || triggerRef.isBlank() ? pipelineId : triggerRef;
        steps       = List.copyOf(steps);
    }

    public TriggerKey triggerKey() {
        return new TriggerKey(triggerType, repoId, triggerRef);
    }
}
