package com.conveyor.orchestrator.debug;

import com.conveyor.orchestrator.MutableClock;
import com.conveyor.orchestrator.auth.InvalidTokenException;
import com.conveyor.orchestrator.event.DebugResumedEvent;
import com.conveyor.orchestrator.event.RunCancelRequestedEvent;
import com.conveyor.orchestrator.model.DebugSession;
import com.conveyor.orchestrator.model.PipelineRun;
import com.conveyor.orchestrator.repository.DebugSessionRepository;
import com.conveyor.orchestrator.service.PipelineRunService;
import com.conveyor.orchestrator.statemachine.DebugState;
import com.conveyor.orchestrator.statemachine.InvalidTransitionException;
import com.conveyor.orchestrator.statemachine.PipelineRunState;
import com.conveyor.orchestrator.statemachine.PreconditionViolationException;
import com.conveyor.orchestrator.statemachine.StateMachineStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Debug session lifecycle over an in-memory stand-in for the
 * debug_sessions table.
 */
@ExtendWith(MockitoExtension.class)
class DebugSessionServiceTest {

    @Mock DebugSessionRepository    repo;
    @Mock PipelineRunService        runs;
    @Mock ApplicationEventPublisher events;

    final Map<UUID, DebugSession> table = new HashMap<>();
    MutableClock clock;
    DebugSessionService debug;

    PipelineRun failed;
    PipelineRun rerun;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T12:00:00Z");
        ObjectMapper json = new ObjectMapper().findAndRegisterModules();
        debug = new DebugSessionService(repo, runs, new StateMachineStore(json, clock), json, events, clock,
                3600, 14400);

        failed = run(PipelineRunState.FAILED);
        rerun  = run(PipelineRunState.PENDING);

        lenient().when(repo.findById(any()))
                .thenAnswer(inv -> Optional.ofNullable(table.get(inv.<UUID>getArgument(0))));
        lenient().when(repo.findForUpdate(any()))
                .thenAnswer(inv -> Optional.ofNullable(table.get(inv.<UUID>getArgument(0))));
        lenient().when(repo.findFirstByPipelineRunIdAndStatusIn(any(), any())).thenAnswer(inv -> {
            UUID runId = inv.getArgument(0);
            Collection<?> states = inv.getArgument(1);
            return table.values().stream()
                    .filter(s -> s.getPipelineRunId().equals(runId) && states.contains(s.getStatus()))
                    .findFirst();
        });
        lenient().when(repo.save(any())).thenAnswer(inv -> {
            DebugSession s = inv.getArgument(0);
            if (s.getId() == null) {
                ReflectionTestUtils.setField(s, "id", UUID.randomUUID());
            }
            table.put(s.getId(), s);
            return s;
        });
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    @Test
    void create_failedRun_startsRerunWithPendingSession() {
        DebugRerun created = createSession(List.of(2, 1));

        DebugSession session = created.session();
        assertThat(session.getStatus()).isEqualTo(DebugState.PENDING);
        assertThat(session.getPipelineRunId()).isEqualTo(rerun.getId());
        assertThat(session.getOriginalRunId()).isEqualTo(failed.getId());
        assertThat(debug.breakpointsOf(session)).containsExactly(1, 2);
        assertThat(session.getTokenHash()).isNotEqualTo(created.token());
        assertThat(created.joinCommand()).contains(session.getId().toString()).contains(created.token());
    }

    @Test
    void create_successfulRun_isRejected() {
        PipelineRun done = run(PipelineRunState.COMPLETED);
        when(runs.get(done.getId())).thenReturn(done);

        assertThatThrownBy(() -> debug.create(done.getId(), List.of(0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("COMPLETED");
        verify(runs, never()).rerun(any());
    }

    @Test
    void create_breakpointOutOfRange_isRejected() {
        when(runs.get(failed.getId())).thenReturn(failed);

        assertThatThrownBy(() -> debug.create(failed.getId(), List.of(3)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Breakpoints
    // ------------------------------------------------------------------

    @Test
    void pauseAtBreakpoint_onlyAtBreakpointedSteps() {
        DebugSession session = createSession(List.of(1)).session();

        assertThat(debug.pauseAtBreakpoint(rerun.getId(), 0, "build")).isFalse();
        assertThat(debug.pauseAtBreakpoint(rerun.getId(), 1, "test")).isTrue();

        assertThat(session.getStatus()).isEqualTo(DebugState.WAITING_AT_BP);
        assertThat(session.getCurrentStepIndex()).isEqualTo(1);
        assertThat(session.getExpiresAt()).isEqualTo(clock.instant().plusSeconds(3600));
    }

    @Test
    void connect_withSessionToken_connects() {
        DebugRerun created = pausedAt(1);

        DebugSession session = debug.connect(created.session().getId(), created.token());

        assertThat(session.getStatus()).isEqualTo(DebugState.CONNECTED);
        assertThat(session.getConnectedAt()).isEqualTo(clock.instant());
    }

    @Test
    void connect_withWrongToken_isRejected() {
        DebugRerun created = pausedAt(1);

        assertThatThrownBy(() -> debug.connect(created.session().getId(), "not-the-token"))
                .isInstanceOf(InvalidTokenException.class);
        assertThat(created.session().getStatus()).isEqualTo(DebugState.WAITING_AT_BP);
    }

    @Test
    void disconnect_returnsToWaiting() {
        DebugRerun created = pausedAt(1);
        debug.connect(created.session().getId(), created.token());

        assertThat(debug.disconnect(created.session().getId()).getStatus()).isEqualTo(DebugState.WAITING_AT_BP);
    }

    @Test
    void resume_endsSessionAndContinuesRun() {
        DebugRerun created = pausedAt(1);

        DebugSession session = debug.resume(created.session().getId());

        assertThat(session.getStatus()).isEqualTo(DebugState.ENDED);
        verify(events).publishEvent(new DebugResumedEvent(rerun.getId(), 1));
    }

    @Test
    void resume_beforeBreakpoint_isPreconditionViolation() {
        DebugSession session = createSession(List.of(1)).session();

        assertThatThrownBy(() -> debug.resume(session.getId()))
                .isInstanceOf(PreconditionViolationException.class);
    }

    @Test
    void abort_endsSessionAndCancelsRun() {
        DebugRerun created = pausedAt(1);

        assertThat(debug.abort(created.session().getId()).getStatus()).isEqualTo(DebugState.ENDED);
        verify(events).publishEvent(new RunCancelRequestedEvent(rerun.getId(), "Debug session aborted"));
    }

    @Test
    void abort_endedSession_isInvalidTransition() {
        DebugRerun created = pausedAt(1);
        debug.resume(created.session().getId());

        assertThatThrownBy(() -> debug.abort(created.session().getId()))
                .isInstanceOf(InvalidTransitionException.class);
    }

    // ------------------------------------------------------------------
    // Timeouts
    // ------------------------------------------------------------------

    @Test
    void extend_movesExpiryUpToMaximum() {
        DebugSession session = pausedAt(1).session();

        DebugSession extended = debug.extend(session.getId(), 1800);
        assertThat(extended.getExpiresAt()).isEqualTo(clock.instant().plusSeconds(5400));

        assertThatThrownBy(() -> debug.extend(session.getId(), 4 * 3600))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("4 hours");
    }

    @Test
    void checkTimeouts_expiresPausedSessionsAndCancelsRuns() {
        DebugSession session = pausedAt(1).session();
        clock.advance(Duration.ofHours(2));
        when(repo.findByStatusInAndExpiresAtBefore(any(), any())).thenReturn(List.of(session));

        List<UUID> timedOut = debug.checkTimeouts();

        assertThat(timedOut).containsExactly(session.getId());
        assertThat(session.getStatus()).isEqualTo(DebugState.TIMEOUT);
        verify(events).publishEvent(new RunCancelRequestedEvent(rerun.getId(), "Debug session timed out"));
    }

    @Test
    void onRunFinished_endsOpenSession() {
        DebugSession session = createSession(List.of(1)).session();

        debug.onRunFinished(rerun.getId());

        assertThat(session.getStatus()).isEqualTo(DebugState.ENDED);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DebugRerun createSession(List<Integer> breakpoints) {
        when(runs.get(failed.getId())).thenReturn(failed);
        when(runs.rerun(failed.getId())).thenReturn(rerun);
        return debug.create(failed.getId(), breakpoints);
    }

    private DebugRerun pausedAt(int index) {
        DebugRerun created = createSession(List.of(index));
        debug.pauseAtBreakpoint(rerun.getId(), index, "step-" + index);
        return created;
    }

    private static PipelineRun run(PipelineRunState status) {
        PipelineRun run = new PipelineRun("pipe-1", "repo-1", "push", "main", 3);
        ReflectionTestUtils.setField(run, "id", UUID.randomUUID());
        run.setStatus(status);
        return run;
    }
}
