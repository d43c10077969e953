package com.conveyor.orchestrator.api.dto;

public record ConnectRequest(String token) {}
