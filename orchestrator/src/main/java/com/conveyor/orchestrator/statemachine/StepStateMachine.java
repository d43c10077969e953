package com.conveyor.orchestrator.statemachine;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.conveyor.orchestrator.statemachine.StepExecutionState.*;

/**
 * State machine for a single step execution attempt.
 */
public class StepStateMachine extends StateMachine<StepExecutionState> {

    static final Map<StepExecutionState, Set<StepExecutionState>> TRANSITIONS = table(StepExecutionState.class,
            PENDING,    Set.of(PREPARING, FAILED, CANCELLED),
            PREPARING,  Set.of(RUNNING, FAILED, CANCELLED),
            RUNNING,    Set.of(COMPLETING, FAILED, CANCELLED),
            COMPLETING, Set.of(COMPLETED, FAILED, CANCELLED));

    static final Set<StepExecutionState> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    /** Conventional exit code for a step killed by its timeout. */
    public static final int TIMEOUT_EXIT_CODE = 124;

    public StepStateMachine(Clock clock) {
        this(PENDING, clock);
    }

    public StepStateMachine(StepExecutionState initial, Clock clock) {
        super("step execution", initial, TRANSITIONS, TERMINAL, clock);
    }

    public static StepStateMachine restore(StateMachineSnapshot<StepExecutionState> snapshot, Clock clock) {
        StepStateMachine machine = new StepStateMachine(clock);
        machine.restore(snapshot.state(), snapshot.history());
        return machine;
    }

    /**
     * Put an attempt whose runner or worker was lost back to PENDING. Only
     * PREPARING and RUNNING attempts can be requeued; this edge is not part
     * of the normal transition table.
     */
    public StateTransition<StepExecutionState> requeue(String reason) {
        if (!getState().isActive()) {
            throw new InvalidTransitionException(entity(), getState(), PENDING, isTerminal());
        }
        return repair(PENDING, reason);
    }

    /**
     * Settle a RUNNING or COMPLETING execution from its exit code:
     * 0 ends in COMPLETED, anything else in FAILED.
     */
    public StateTransition<StepExecutionState> finish(int exitCode, String error) {
        if (getState() == RUNNING) {
            transition(COMPLETING, "exit code " + exitCode);
        }
        if (exitCode == 0) {
            return transition(COMPLETED, "exit code 0");
        }
        String reason = exitCode == TIMEOUT_EXIT_CODE ? "timed out" : "exit code " + exitCode;
        return transition(FAILED, error == null ? reason : reason + ": " + error);
    }
}
