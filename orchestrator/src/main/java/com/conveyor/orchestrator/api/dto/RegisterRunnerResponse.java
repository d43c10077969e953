package com.conveyor.orchestrator.api.dto;

/** {@code action} tells a returning runner what to do with the step it remembers. */
public record RegisterRunnerResponse(RunnerResponse runner, String action) {}
