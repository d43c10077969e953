package com.conveyor.orchestrator.auth;

/** A bearer token was presented but is unknown, expired, or for something else. */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }
}
