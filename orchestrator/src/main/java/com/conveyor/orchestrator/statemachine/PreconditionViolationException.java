package com.conveyor.orchestrator.statemachine;

/**
 * The target state is adjacent but the entity is not ready for it yet,
 * e.g. cleaning a workspace that still has active users. Unlike
 * {@link InvalidTransitionException} this is an ordering problem and the same
 * transition may succeed later.
 */
public class PreconditionViolationException extends RuntimeException {

    public PreconditionViolationException(String message) {
        super(message);
    }
}
