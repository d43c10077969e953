package com.conveyor.orchestrator.driver.dto;

/**
 * Final outcome of one container run.
 *
 * @param exitCode 124 when the driver killed the container on timeout
 */
public record DriverResult(boolean success, int exitCode, String error, String containerId) {}
