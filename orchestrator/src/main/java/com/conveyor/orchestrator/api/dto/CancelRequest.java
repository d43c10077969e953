package com.conveyor.orchestrator.api.dto;

/** Optional body for POST /api/pipeline-runs/{id}/cancel. */
public record CancelRequest(String reason) {}
