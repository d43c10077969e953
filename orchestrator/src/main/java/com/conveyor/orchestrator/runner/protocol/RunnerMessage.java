package com.conveyor.orchestrator.runner.protocol;

import com.conveyor.orchestrator.routing.RunnerLabels;

import java.util.List;
import java.util.UUID;

/**
 * Messages a runner sends to the backend. Instances only exist after
 * {@link RunnerProtocol#parse} has checked every required field.
 */
public sealed interface RunnerMessage {

    record Register(String runnerId, String name, String runnerType, RunnerLabels labels) implements RunnerMessage {}

    record Ack(UUID stepId) implements RunnerMessage {}

    record Heartbeat() implements RunnerMessage {}

    record Log(UUID stepId, List<String> lines) implements RunnerMessage {}

    record StepComplete(UUID stepId, int exitCode, String error) implements RunnerMessage {}
}
