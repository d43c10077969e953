package com.conveyor.orchestrator.execution;

import com.conveyor.orchestrator.model.StepKind;
import com.conveyor.orchestrator.routing.StepRequirements;

/**
 * One step as declared in a pipeline definition. Stored as JSON on the
 * step_runs row so every attempt sees the definition the run started with.
 *
 * @param retries extra attempts after the first failure before the failure
 *                policy applies
 */
public record StepDefinition(
        String name,
        StepKind type,
        StepConfig config,
        StepRequirements requirements,
        String onSuccess,
        String onFailure,
        Integer timeoutSeconds,
        int retries
) {
    public StepDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name is required");
        }
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0, got " + retries);
        }
        type         = type == null ? StepKind.SCRIPT : type;
        config       = config == null ? StepConfig.empty() : config;
        requirements = requirements == null ? StepRequirements.none() : requirements;
        onSuccess    = onSuccess == null || onSuccess.isBlank() ? "next" : onSuccess;
        onFailure    = onFailure == null || onFailure.isBlank() ? "stop" : onFailure;
    }

    public static StepDefinition script(String name, String command) {
        return new StepDefinition(name, StepKind.SCRIPT, StepConfig.command(command), null, null, null, null, 0);
    }

    public StepDefinition withOnFailure(String policy) {
        return new StepDefinition(name, type, config, requirements, onSuccess, policy, timeoutSeconds, retries);
    }

    public StepDefinition withOnSuccess(String policy) {
        return new StepDefinition(name, type, config, requirements, policy, onFailure, timeoutSeconds, retries);
    }
}
