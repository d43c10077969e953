package com.conveyor.orchestrator.driver;

/**
 * Thrown when the container driver is unreachable or answers with a non-2xx
 * status. Callers turn it into a FAILED transition, never an API error.
 */
public class DriverException extends RuntimeException {

    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
