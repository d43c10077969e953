package com.conveyor.orchestrator.statemachine;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Properties every machine must satisfy: canTransition agrees with
 * transition for every (state, target) pair, and terminal states have no
 * way out.
 */
class StateMachineContractTest {

    final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void pipeline_canTransitionAgreesWithTransition() {
        assertAgreement(PipelineRunState.values(), s -> PipelineStateMachine.restore(
                new PipelineRunSnapshot(s, 3, new TreeSet<>(), null, null, null, null, null, null, null, List.of()),
                clock));
    }

    @Test
    void stepExecution_canTransitionAgreesWithTransition() {
        assertAgreement(StepExecutionState.values(), s -> new StepStateMachine(s, clock));
    }

    @Test
    void debug_canTransitionAgreesWithTransition() {
        assertAgreement(DebugState.values(), s -> DebugStateMachine.restore(
                new StateMachineSnapshot<>(s, List.of()), clock));
    }

    @Test
    void workspace_canTransitionAgreesWithTransition_atEveryUseCount() {
        for (int useCount = 0; useCount <= 2; useCount++) {
            int n = useCount;
            assertAgreement(WorkspaceState.values(), s -> WorkspaceStateMachine.restore(
                    new WorkspaceSnapshot(s, n, clock.instant(), List.of()), clock));
        }
    }

    @Test
    void terminalStates_haveNoOutgoingTransitions() {
        for (PipelineRunState s : PipelineStateMachine.TERMINAL) {
            assertThat(PipelineStateMachine.TRANSITIONS.getOrDefault(s, java.util.Set.of())).isEmpty();
        }
        for (StepExecutionState s : StepStateMachine.TERMINAL) {
            assertThat(StepStateMachine.TRANSITIONS.getOrDefault(s, java.util.Set.of())).isEmpty();
        }
        for (WorkspaceState s : WorkspaceStateMachine.TERMINAL) {
            assertThat(WorkspaceStateMachine.TRANSITIONS.getOrDefault(s, java.util.Set.of())).isEmpty();
        }
        for (DebugState s : DebugStateMachine.TERMINAL) {
            assertThat(DebugStateMachine.TRANSITIONS.getOrDefault(s, java.util.Set.of())).isEmpty();
        }
    }

    @Test
    void transitionFromTerminal_namesTerminalStateInMessage() {
        StepStateMachine m = new StepStateMachine(StepExecutionState.COMPLETED, clock);

        assertThatThrownBy(() -> m.transition(StepExecutionState.RUNNING))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("COMPLETED -> RUNNING")
                .hasMessageContaining("terminal state COMPLETED")
                .satisfies(e -> assertThat(((InvalidTransitionException) e).isTerminal()).isTrue());
    }

    @Test
    void selfTransition_isRejectedUnlessListed() {
        StepStateMachine m = new StepStateMachine(StepExecutionState.RUNNING, clock);

        assertThat(m.canTransition(StepExecutionState.RUNNING)).isFalse();
        assertThatThrownBy(() -> m.transition(StepExecutionState.RUNNING))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void history_recordsEveryTransitionInOrder() {
        StepStateMachine m = new StepStateMachine(clock);
        m.transition(StepExecutionState.PREPARING, "assigned");
        m.transition(StepExecutionState.RUNNING);

        assertThat(m.getHistory()).extracting(StateTransition::from)
                .containsExactly(StepExecutionState.PENDING, StepExecutionState.PREPARING);
        assertThat(m.getHistory()).extracting(StateTransition::to)
                .containsExactly(StepExecutionState.PREPARING, StepExecutionState.RUNNING);
        assertThat(m.getHistory().get(0).reason()).isEqualTo("assigned");
        assertThat(m.getHistory().get(0).timestamp()).isEqualTo(clock.instant());
    }

    @Test
    void duration_emptyWithoutHistory() {
        assertThat(new StepStateMachine(clock).duration()).isEmpty();
    }

    private <S extends Enum<S>> void assertAgreement(S[] states, Function<S, StateMachine<S>> factory) {
        for (S from : states) {
            for (S target : states) {
                boolean predicted = factory.apply(from).canTransition(target);
                Throwable thrown = catchThrowable(() -> factory.apply(from).transition(target, "contract check"));
                assertThat(thrown == null)
                        .as("%s -> %s: canTransition=%s, transition threw %s", from, target, predicted, thrown)
                        .isEqualTo(predicted);
                if (thrown != null) {
                    assertThat(thrown).isInstanceOfAny(InvalidTransitionException.class,
                            PreconditionViolationException.class);
                }
            }
        }
    }
}
