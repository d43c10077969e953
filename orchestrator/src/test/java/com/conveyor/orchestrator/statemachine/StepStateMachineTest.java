package com.conveyor.orchestrator.statemachine;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.conveyor.orchestrator.statemachine.StepExecutionState.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepStateMachineTest {

    final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void finish_exitZero_passesThroughCompleting() {
        StepStateMachine m = new StepStateMachine(RUNNING, clock);

        m.finish(0, null);

        assertThat(m.getState()).isEqualTo(COMPLETED);
        assertThat(m.getHistory()).extracting(StateTransition::to).containsExactly(COMPLETING, COMPLETED);
    }

    @Test
    void finish_nonZero_fails() {
        StepStateMachine m = new StepStateMachine(RUNNING, clock);

        m.finish(2, "tests failed");

        assertThat(m.getState()).isEqualTo(FAILED);
        assertThat(m.lastTransition().orElseThrow().reason()).isEqualTo("exit code 2: tests failed");
    }

    @Test
    void finish_timeoutExitCode_reportsTimedOut() {
        StepStateMachine m = new StepStateMachine(RUNNING, clock);

        m.finish(StepStateMachine.TIMEOUT_EXIT_CODE, null);

        assertThat(m.getState()).isEqualTo(FAILED);
        assertThat(m.lastTransition().orElseThrow().reason()).isEqualTo("timed out");
    }

    @Test
    void cancel_reachableFromEveryNonTerminalState() {
        for (StepExecutionState s : new StepExecutionState[]{PENDING, PREPARING, RUNNING, COMPLETING}) {
            assertThat(new StepStateMachine(s, clock).canTransition(CANCELLED)).as("from %s", s).isTrue();
        }
    }

    @Test
    void requeue_fromRunning_returnsToPendingAndRecordsReason() {
        StepStateMachine m = new StepStateMachine(clock);
        m.transition(PREPARING);
        m.transition(RUNNING);

        m.requeue("runner r1 died");

        assertThat(m.getState()).isEqualTo(PENDING);
        assertThat(m.lastTransition().orElseThrow())
                .extracting(StateTransition::from, StateTransition::to, StateTransition::reason)
                .containsExactly(RUNNING, PENDING, "runner r1 died");
        // The normal table still has no way back to PENDING.
        assertThat(new StepStateMachine(RUNNING, clock).canTransition(PENDING)).isFalse();
    }

    @Test
    void requeue_fromPendingOrTerminal_isRejected() {
        assertThatThrownBy(() -> new StepStateMachine(PENDING, clock).requeue("x"))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> new StepStateMachine(COMPLETED, clock).requeue("x"))
                .isInstanceOf(InvalidTransitionException.class);
    }
}
