package com.conveyor.orchestrator.statemachine;

import java.util.List;

/**
 * Serializable form of a plain state machine: current state plus full history.
 */
public record StateMachineSnapshot<S extends Enum<S>>(
        S state,
        List<StateTransition<S>> history
) {}
