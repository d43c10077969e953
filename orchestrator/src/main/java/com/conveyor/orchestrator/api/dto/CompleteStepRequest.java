package com.conveyor.orchestrator.api.dto;

import java.util.UUID;

/** Request body for POST /api/runners/{id}/complete. */
public record CompleteStepRequest(UUID stepId, int exitCode, String error) {}
