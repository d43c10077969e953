package com.conveyor.orchestrator.api.dto;

import java.util.List;
import java.util.UUID;

/** Request body for POST /api/debug: re-run {@code runId} pausing before each breakpoint index. */
public record DebugRerunRequest(UUID runId, List<Integer> breakpoints) {}
