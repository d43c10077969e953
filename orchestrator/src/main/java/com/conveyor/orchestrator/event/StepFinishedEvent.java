package com.conveyor.orchestrator.event;

import java.util.UUID;

/**
 * An executor has a result for a step execution attempt. The pipeline
 * executor settles the attempt and decides what runs next.
 *
 * @param runnerId the remote runner that ran it, or null for local execution
 */
public record StepFinishedEvent(UUID stepExecutionId, int exitCode, String error, String runnerId) {}
