package com.conveyor.orchestrator.statemachine;

import java.time.Instant;

/**
 * One entry in a state machine's append-only history.
 *
 * @param reason free-form explanation, may be null
 */
public record StateTransition<S extends Enum<S>>(
        S from,
        S to,
        Instant timestamp,
        String reason
) {}
