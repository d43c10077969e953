package com.conveyor.orchestrator.event;

import java.util.UUID;

/** A new pipeline run was created and should start executing once committed. */
public record RunAdmittedEvent(UUID pipelineRunId) {}
