package com.conveyor.orchestrator.runner.protocol;

/** An inbound runner message is malformed, incomplete or of an unknown type. */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }
}
