package com.conveyor.orchestrator.statemachine;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.conveyor.orchestrator.statemachine.DebugState.*;

/**
 * State machine for a debug session. CONNECTED and WAITING_AT_BP may
 * alternate any number of times as the CLI disconnects and reconnects.
 */
public class DebugStateMachine extends StateMachine<DebugState> {

    static final Map<DebugState, Set<DebugState>> TRANSITIONS = table(DebugState.class,
            PENDING,       Set.of(WAITING_AT_BP, ENDED),
            WAITING_AT_BP, Set.of(CONNECTED, TIMEOUT, ENDED),
            CONNECTED,     Set.of(ENDED, TIMEOUT, WAITING_AT_BP));

    static final Set<DebugState> TERMINAL = EnumSet.of(TIMEOUT, ENDED);

    public DebugStateMachine(Clock clock) {
        super("debug session", PENDING, TRANSITIONS, TERMINAL, clock);
    }

    public static DebugStateMachine restore(StateMachineSnapshot<DebugState> snapshot, Clock clock) {
        DebugStateMachine machine = new DebugStateMachine(clock);
        machine.restore(snapshot.state(), snapshot.history());
        return machine;
    }

    public boolean isActive() {
        return !isTerminal();
    }
}
