package com.conveyor.orchestrator.recovery;

import com.conveyor.orchestrator.MutableClock;
import com.conveyor.orchestrator.event.StepRequeuedEvent;
import com.conveyor.orchestrator.execution.StepExecutionService;
import com.conveyor.orchestrator.model.Runner;
import com.conveyor.orchestrator.model.RunnerStatus;
import com.conveyor.orchestrator.model.StepExecution;
import com.conveyor.orchestrator.repository.RunnerRepository;
import com.conveyor.orchestrator.repository.StepExecutionRepository;
import com.conveyor.orchestrator.statemachine.StepExecutionState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobRecoveryServiceTest {

    @Mock RunnerRepository          runnerRepo;
    @Mock StepExecutionRepository   executionRepo;
    @Mock StepExecutionService      executions;
    @Mock ApplicationEventPublisher events;

    MutableClock clock;
    SimpleMeterRegistry meters;
    JobRecoveryService recovery;

    @BeforeEach
    void setUp() {
        clock    = MutableClock.at("2024-05-01T12:00:00Z");
        meters   = new SimpleMeterRegistry();
        recovery = new JobRecoveryService(runnerRepo, executionRepo, executions, events, meters, clock);
    }

    // ------------------------------------------------------------------
    // Runner death
    // ------------------------------------------------------------------

    @Test
    void onRunnerDeath_requeuesHeldStepAndMarksDead() {
        StepExecution running = execution("r1", StepExecutionState.RUNNING);
        Runner r1 = runner("r1", RunnerStatus.BUSY);
        r1.setCurrentStepExecutionId(running.getId());
        when(runnerRepo.findForUpdate("r1")).thenReturn(Optional.of(r1));
        when(executionRepo.findByRunnerIdAndStatusIn(eq("r1"), any())).thenReturn(List.of(running));
        when(executions.requeue(eq(running.getId()), anyString())).thenReturn(Optional.of(running));

        List<StepExecution> requeued = recovery.onRunnerDeath("r1");

        assertThat(requeued).containsExactly(running);
        verify(executions, times(1)).requeue(eq(running.getId()), anyString());
        verify(events).publishEvent(new StepRequeuedEvent(running.getId(), "runner r1 died"));
        assertThat(r1.getStatus()).isEqualTo(RunnerStatus.DEAD);
        assertThat(r1.getCurrentStepExecutionId()).isNull();
        verify(runnerRepo).save(r1);
        assertThat(meters.get("conveyor.recovery.requeued").counter().count()).isEqualTo(1.0);
    }

    @Test
    void onRunnerDeath_secondCall_requeuesNothing() {
        Runner dead = runner("r1", RunnerStatus.DEAD);
        when(runnerRepo.findForUpdate("r1")).thenReturn(Optional.of(dead));
        when(executionRepo.findByRunnerIdAndStatusIn(eq("r1"), any())).thenReturn(List.of());

        assertThat(recovery.onRunnerDeath("r1")).isEmpty();
        verifyNoInteractions(executions, events);
    }

    @Test
    void onRunnerDeath_alreadyRequeuedStep_isNotAnnouncedAgain() {
        StepExecution pending = execution(null, StepExecutionState.PENDING);
        Runner r1 = runner("r1", RunnerStatus.BUSY);
        r1.setCurrentStepExecutionId(pending.getId());
        when(runnerRepo.findForUpdate("r1")).thenReturn(Optional.of(r1));
        when(executionRepo.findByRunnerIdAndStatusIn(eq("r1"), any())).thenReturn(List.of());
        when(executions.requeue(eq(pending.getId()), anyString())).thenReturn(Optional.empty());

        assertThat(recovery.onRunnerDeath("r1")).isEmpty();
        verifyNoInteractions(events);
        assertThat(r1.getStatus()).isEqualTo(RunnerStatus.DEAD);
    }

    @Test
    void onRunnerDeath_unknownRunner_isIgnored() {
        when(runnerRepo.findForUpdate("ghost")).thenReturn(Optional.empty());

        assertThat(recovery.onRunnerDeath("ghost")).isEmpty();
        verify(runnerRepo, never()).save(any());
    }

    @Test
    void onRunnerSilent_reconnectedSinceSweepRead_keepsRunnerAndStep() {
        Instant cutoff = clock.instant().minus(Duration.ofSeconds(30));
        StepExecution running = execution("r1", StepExecutionState.RUNNING);
        Runner r1 = runner("r1", RunnerStatus.BUSY);
        r1.setCurrentStepExecutionId(running.getId());
        when(runnerRepo.findForUpdate("r1")).thenReturn(Optional.of(r1));

        assertThat(recovery.onRunnerSilent("r1", cutoff)).isFalse();

        verify(executions, never()).requeue(any(), anyString());
        verify(runnerRepo, never()).save(any());
        assertThat(r1.getStatus()).isEqualTo(RunnerStatus.BUSY);
        assertThat(r1.getCurrentStepExecutionId()).isEqualTo(running.getId());
    }

    @Test
    void onRunnerSilent_stillSilentUnderLock_declaresDead() {
        Instant cutoff = clock.instant().minus(Duration.ofSeconds(30));
        StepExecution running = execution("r1", StepExecutionState.RUNNING);
        Runner r1 = runner("r1", RunnerStatus.OFFLINE);
        r1.setCurrentStepExecutionId(running.getId());
        r1.setLastHeartbeatAt(clock.instant().minus(Duration.ofSeconds(45)));
        when(runnerRepo.findForUpdate("r1")).thenReturn(Optional.of(r1));
        when(executionRepo.findByRunnerIdAndStatusIn(eq("r1"), any())).thenReturn(List.of(running));
        when(executions.requeue(eq(running.getId()), anyString())).thenReturn(Optional.of(running));

        assertThat(recovery.onRunnerSilent("r1", cutoff)).isTrue();

        verify(executions).requeue(eq(running.getId()), anyString());
        assertThat(r1.getStatus()).isEqualTo(RunnerStatus.DEAD);
    }

    @Test
    void onRunnerSilent_alreadyDead_isNoOp() {
        Runner r1 = runner("r1", RunnerStatus.DEAD);
        r1.setLastHeartbeatAt(clock.instant().minus(Duration.ofMinutes(5)));
        when(runnerRepo.findForUpdate("r1")).thenReturn(Optional.of(r1));

        assertThat(recovery.onRunnerSilent("r1", clock.instant().minus(Duration.ofSeconds(30)))).isFalse();

        verifyNoInteractions(executions);
    }

    // ------------------------------------------------------------------
    // Reconnect
    // ------------------------------------------------------------------

    @Test
    void onRunnerReconnect_stillAssigned_continues() {
        StepExecution running = execution("r1", StepExecutionState.RUNNING);
        Runner r1 = runner("r1", RunnerStatus.OFFLINE);
        r1.setCurrentStepExecutionId(running.getId());
        when(runnerRepo.findForUpdate("r1")).thenReturn(Optional.of(r1));
        when(executionRepo.findById(running.getId())).thenReturn(Optional.of(running));

        assertThat(recovery.onRunnerReconnect("r1")).isEqualTo(ReconnectAction.CONTINUE);
        assertThat(r1.getStatus()).isEqualTo(RunnerStatus.BUSY);
    }

    @Test
    void onRunnerReconnect_stepReassigned_aborts() {
        StepExecution moved = execution("r2", StepExecutionState.RUNNING);
        Runner r1 = runner("r1", RunnerStatus.IDLE);
        r1.setCurrentStepExecutionId(moved.getId());
        when(runnerRepo.findForUpdate("r1")).thenReturn(Optional.of(r1));
        when(executionRepo.findById(moved.getId())).thenReturn(Optional.of(moved));

        assertThat(recovery.onRunnerReconnect("r1")).isEqualTo(ReconnectAction.ABORT);
        assertThat(r1.getCurrentStepExecutionId()).isNull();
    }

    @Test
    void onRunnerReconnect_stepAlreadySettled_aborts() {
        StepExecution done = execution("r1", StepExecutionState.COMPLETED);
        Runner r1 = runner("r1", RunnerStatus.BUSY);
        r1.setCurrentStepExecutionId(done.getId());
        when(runnerRepo.findForUpdate("r1")).thenReturn(Optional.of(r1));
        when(executionRepo.findById(done.getId())).thenReturn(Optional.of(done));

        assertThat(recovery.onRunnerReconnect("r1")).isEqualTo(ReconnectAction.ABORT);
        assertThat(r1.getStatus()).isEqualTo(RunnerStatus.IDLE);
    }

    @Test
    void onRunnerReconnect_nothingHeld_goesIdle() {
        when(runnerRepo.findForUpdate("r1")).thenReturn(Optional.of(runner("r1", RunnerStatus.IDLE)));

        assertThat(recovery.onRunnerReconnect("r1")).isEqualTo(ReconnectAction.IDLE);
    }

    // ------------------------------------------------------------------
    // Startup scan
    // ------------------------------------------------------------------

    @Test
    void recoverOrphanedSteps_requeuesOnlyUnownedWork() {
        StepExecution local = execution(null, StepExecutionState.RUNNING);
        StepExecution onDead = execution("dead", StepExecutionState.RUNNING);
        StepExecution onSilent = execution("silent", StepExecutionState.PREPARING);
        StepExecution onLive = execution("live", StepExecutionState.RUNNING);
        when(executionRepo.findByStatusIn(any())).thenReturn(List.of(local, onDead, onSilent, onLive));

        Runner silent = runner("silent", RunnerStatus.IDLE);
        silent.setLastHeartbeatAt(clock.instant().minus(Duration.ofMinutes(5)));
        when(runnerRepo.findById("dead")).thenReturn(Optional.of(runner("dead", RunnerStatus.DEAD)));
        when(runnerRepo.findById("silent")).thenReturn(Optional.of(silent));
        when(runnerRepo.findById("live")).thenReturn(Optional.of(runner("live", RunnerStatus.BUSY)));
        when(executions.requeue(any(), anyString()))
                .thenAnswer(inv -> Optional.of(byId(inv.getArgument(0), local, onDead, onSilent, onLive)));

        List<StepExecution> recovered = recovery.recoverOrphanedSteps();

        assertThat(recovered).containsExactly(local, onDead, onSilent);
        verify(executions, never()).requeue(eq(onLive.getId()), anyString());
        verify(events, times(3)).publishEvent(any(StepRequeuedEvent.class));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Runner runner(String id, RunnerStatus status) {
        Runner r = new Runner(id, id, "any", null, clock.instant());
        r.setStatus(status);
        return r;
    }

    private static StepExecution execution(String runnerId, StepExecutionState status) {
        UUID run = UUID.randomUUID();
        StepExecution e = new StepExecution(run + ":0:1", UUID.randomUUID(), run, 0, 1);
        ReflectionTestUtils.setField(e, "id", UUID.randomUUID());
        e.setRunnerId(runnerId);
        e.setStatus(status);
        return e;
    }

    private static StepExecution byId(UUID id, StepExecution... candidates) {
        for (StepExecution e : candidates) {
            if (e.getId().equals(id)) {
                return e;
            }
        }
        throw new IllegalArgumentException(id.toString());
    }
}
