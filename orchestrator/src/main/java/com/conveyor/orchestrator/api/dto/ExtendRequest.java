package com.conveyor.orchestrator.api.dto;

public record ExtendRequest(int additionalSeconds) {}
