package com.conveyor.orchestrator.api.dto;

/**
 * Status report from inside a step container.
 *
 * @param status   running, completed or failed
 * @param exitCode required for failed; completed defaults to 0
 */
public record StepStatusRequest(String status, Integer exitCode, String error, String containerId) {}
