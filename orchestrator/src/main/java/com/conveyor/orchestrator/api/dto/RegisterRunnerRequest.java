package com.conveyor.orchestrator.api.dto;

import com.conveyor.orchestrator.routing.RunnerLabels;

/** Request body for POST /api/runners/register. A null runnerId gets one generated. */
public record RegisterRunnerRequest(String runnerId, String name, String runnerType, RunnerLabels labels) {}
