package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.MutableClock;
import com.conveyor.orchestrator.driver.ContainerDriverClient;
import com.conveyor.orchestrator.driver.DriverException;
import com.conveyor.orchestrator.driver.dto.DriverEvent;
import com.conveyor.orchestrator.driver.dto.DriverResult;
import com.conveyor.orchestrator.event.StepFinishedEvent;
import com.conveyor.orchestrator.execution.ExecutionConfig;
import com.conveyor.orchestrator.execution.StepExecutionService;
import com.conveyor.orchestrator.model.StepKind;
import com.conveyor.orchestrator.routing.ExecutorType;
import com.conveyor.orchestrator.statemachine.InvalidTransitionException;
import com.conveyor.orchestrator.statemachine.StepExecutionState;
import com.conveyor.orchestrator.workspace.LockType;
import com.conveyor.orchestrator.workspace.WorkspaceLockManager;
import com.conveyor.orchestrator.workspace.WorkspaceService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LocalStepExecutorTest {

    static final String WORKSPACE = "ws-1";

    @Mock ContainerDriverClient     driver;
    @Mock StepExecutionService      executions;
    @Mock WorkspaceService          workspaces;
    @Mock ApplicationEventPublisher events;
    @Mock ScheduledExecutorService  timers;
    @Mock ScheduledFuture<?>        heartbeat;

    WorkspaceLockManager locks;
    LocalStepExecutor    executor;
    LocalJob             job;

    @BeforeEach
    void setUp() {
        locks = new WorkspaceLockManager(MutableClock.at("2024-05-01T12:00:00Z"));
        executor = new LocalStepExecutor(driver, executions, workspaces, locks, events, timers,
                1, Duration.ofSeconds(10));
        UUID runId = UUID.randomUUID();
        ExecutionConfig config = new ExecutionConfig(runId + ":0:1", StepKind.SCRIPT,
                "conveyor-base:latest", List.of("bash", "-c", "make"), Map.of(),
                "/workspace", "conveyor-" + WORKSPACE, 60);
        job = new LocalJob(UUID.randomUUID(), runId, 0, WORKSPACE, config);
        lenient().when(workspaces.getLockTimeout()).thenReturn(Duration.ofMillis(100));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void run_successfulContainer_marksRunningStreamsLogsAndPublishesResult() {
        doReturn(heartbeat).when(timers).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        when(driver.executeStep(eq(job.config()), any())).thenAnswer(inv -> {
            Consumer<DriverEvent> onEvent = inv.getArgument(1);
            onEvent.accept(new DriverEvent("status", "running", "c-1", null, null, null, null));
            onEvent.accept(new DriverEvent("log", null, null, "compiling", null, null, null));
            return new DriverResult(true, 0, null, "c-1");
        });

        executor.run(job);

        verify(executions).markPreparing(job.stepExecutionId(), ExecutorType.LOCAL, null);
        verify(executions).markRunning(job.stepExecutionId(), "c-1");
        verify(executions).appendLogs(job.stepExecutionId(), List.of("compiling"));
        verify(workspaces).acquire(eq(WORKSPACE), anyString());
        verify(workspaces).release(eq(WORKSPACE), anyString());
        verify(heartbeat).cancel(false);
        assertThat(locks.isLocked(WORKSPACE)).isFalse();
        assertThat(published().exitCode()).isZero();
    }

    @Test
    void run_heartbeatTickAfterStepEnds_doesNothing() {
        ArgumentCaptor<Runnable> beat = ArgumentCaptor.forClass(Runnable.class);
        doReturn(heartbeat).when(timers).scheduleAtFixedRate(beat.capture(), anyLong(), anyLong(), any(TimeUnit.class));
        when(driver.executeStep(eq(job.config()), any())).thenAnswer(inv -> {
            Consumer<DriverEvent> onEvent = inv.getArgument(1);
            onEvent.accept(new DriverEvent("status", "running", "c-1", null, null, null, null));
            beat.getValue().run();
            return new DriverResult(true, 0, null, "c-1");
        });

        executor.run(job);
        beat.getValue().run();

        verify(executions, times(1)).heartbeat(job.stepExecutionId());
    }

    @Test
    void run_heartbeatInProgressWhenStepEnds_finishesBeforeWorkspaceRelease() {
        List<String> order = new CopyOnWriteArrayList<>();
        CountDownLatch beating = new CountDownLatch(1);
        ArgumentCaptor<Runnable> beat = ArgumentCaptor.forClass(Runnable.class);
        doReturn(heartbeat).when(timers).scheduleAtFixedRate(beat.capture(), anyLong(), anyLong(), any(TimeUnit.class));
        when(executions.heartbeat(job.stepExecutionId())).thenAnswer(inv -> {
            beating.countDown();
            Thread.sleep(200);
            order.add("heartbeat");
            return true;
        });
        when(workspaces.release(eq(WORKSPACE), anyString())).thenAnswer(inv -> {
            order.add("release");
            return null;
        });
        when(driver.executeStep(eq(job.config()), any())).thenAnswer(inv -> {
            Consumer<DriverEvent> onEvent = inv.getArgument(1);
            onEvent.accept(new DriverEvent("status", "running", "c-1", null, null, null, null));
            new Thread(beat.getValue(), "heartbeat-tick").start();
            assertThat(beating.await(5, TimeUnit.SECONDS)).isTrue();
            return new DriverResult(true, 0, null, "c-1");
        });

        executor.run(job);

        assertThat(order).containsExactly("heartbeat", "release");
    }

    @Test
    void run_holdsSharedLockWhileContainerRuns() {
        when(driver.executeStep(eq(job.config()), any())).thenAnswer(inv -> {
            assertThat(locks.held(WORKSPACE))
                    .singleElement()
                    .satisfies(l -> assertThat(l.type()).isEqualTo(LockType.SHARED));
            return new DriverResult(true, 0, null, "c-1");
        });

        executor.run(job);

        assertThat(locks.isLocked(WORKSPACE)).isFalse();
    }

    @Test
    void run_driverUnreachable_publishesFailureAndReleasesWorkspace() {
        when(driver.executeStep(eq(job.config()), any())).thenThrow(new DriverException("connection refused"));

        executor.run(job);

        StepFinishedEvent result = published();
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.error()).contains("connection refused");
        verify(workspaces).release(eq(WORKSPACE), anyString());
        assertThat(locks.isLocked(WORKSPACE)).isFalse();
    }

    @Test
    void run_workspaceExclusivelyLocked_failsAfterTimeout() {
        locks.acquire(WORKSPACE, LockType.EXCLUSIVE, "cleanup", Duration.ZERO);

        executor.run(job);

        assertThat(published().error()).contains("Timed out waiting for workspace");
        verifyNoInteractions(driver);
    }

    @Test
    void run_executionAlreadyCancelled_skipsWithoutResult() {
        when(executions.markPreparing(job.stepExecutionId(), ExecutorType.LOCAL, null))
                .thenThrow(new InvalidTransitionException("step execution",
                        StepExecutionState.CANCELLED, StepExecutionState.PREPARING, true));

        executor.run(job);

        verifyNoInteractions(driver, events);
    }

    private StepFinishedEvent published() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(events).publishEvent(captor.capture());
        return (StepFinishedEvent) captor.getValue();
    }
}
