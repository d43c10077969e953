package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.model.PipelineRun;
import com.conveyor.orchestrator.trigger.TriggerCheckResult;

/**
 * Result of a trigger: the new run, or the dedup verdict naming the run
 * the original trigger started.
 */
public record TriggerOutcome(PipelineRun run, TriggerCheckResult check) {

    public boolean isDuplicate() {
        return check.isDuplicate();
    }
}
