package com.conveyor.orchestrator.driver.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of the driver's NDJSON execution stream.
 *
 * type = "status": status + containerId (e.g. "running")
 * type = "log":    line
 * type = "result": success + exitCode (+ error)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DriverEvent(
        String type,
        String status,
        @JsonProperty("container_id") String containerId,
        String line,
        Boolean success,
        @JsonProperty("exit_code") Integer exitCode,
        String error
) {
    public boolean isStatus() { return "status".equals(type); }
    public boolean isLog()    { return "log".equals(type); }
    public boolean isResult() { return "result".equals(type); }
}
