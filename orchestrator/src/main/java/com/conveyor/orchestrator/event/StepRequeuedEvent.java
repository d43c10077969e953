package com.conveyor.orchestrator.event;

import java.util.UUID;

/** A step execution was reset to PENDING by recovery and needs dispatching again. */
public record StepRequeuedEvent(UUID stepExecutionId, String reason) {}
