package com.conveyor.orchestrator.execution;

import java.util.Map;

/**
 * What to run for a step. Which fields matter depends on the step kind:
 * scripts and docker steps use {@code command}, agent steps use
 * {@code runnerType} and {@code prompt}, docker steps require {@code image}.
 */
public record StepConfig(
        String image,
        String command,
        Map<String, String> environment,
        String workingDir,
        String runnerType,
        String prompt
) {
    public StepConfig {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static StepConfig empty() {
        return new StepConfig(null, null, Map.of(), null, null, null);
    }

    public static StepConfig command(String command) {
        return new StepConfig(null, command, Map.of(), null, null, null);
    }
}
