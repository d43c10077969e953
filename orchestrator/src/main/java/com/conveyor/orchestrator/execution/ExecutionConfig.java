package com.conveyor.orchestrator.execution;

import com.conveyor.orchestrator.model.StepKind;

import java.util.List;
import java.util.Map;

/**
 * Fully resolved container configuration for one execution attempt, as sent
 * to the local container driver or to a remote runner.
 */
public record ExecutionConfig(
        String executionKey,
        StepKind kind,
        String image,
        List<String> command,
        Map<String, String> environment,
        String workingDir,
        String volumeName,
        int timeoutSeconds
) {
    public ExecutionConfig {
        command     = List.copyOf(command);
        environment = Map.copyOf(environment);
    }
}
