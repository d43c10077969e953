package com.conveyor.orchestrator.routing;

/**
 * A step cannot be placed: it needs a remote runner while remote execution
 * is disabled, or its configuration is incomplete.
 */
public class RoutingException extends RuntimeException {

    public RoutingException(String message) {
        super(message);
    }
}
