package com.conveyor.orchestrator.api.dto;

import java.util.List;
import java.util.UUID;

/** Log lines pushed by a step container or a runner. {@code stepId} is only used by runners. */
public record LogLinesRequest(UUID stepId, List<String> lines) {}
