package com.conveyor.orchestrator.event;

import java.util.UUID;

/** Some component other than the API wants a run cancelled (debug abort, debug timeout). */
public record RunCancelRequestedEvent(UUID pipelineRunId, String reason) {}
