package com.conveyor.orchestrator.event;

import java.util.UUID;

/** The user released a breakpoint; execution continues at {@code stepIndex}. */
public record DebugResumedEvent(UUID pipelineRunId, int stepIndex) {}
