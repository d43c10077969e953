package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.MutableClock;
import com.conveyor.orchestrator.event.RunAdmittedEvent;
import com.conveyor.orchestrator.execution.StepDefinition;
import com.conveyor.orchestrator.model.PipelineRun;
import com.conveyor.orchestrator.model.StepRun;
import com.conveyor.orchestrator.model.StepRunStatus;
import com.conveyor.orchestrator.model.TriggerRecord;
import com.conveyor.orchestrator.repository.PipelineRunRepository;
import com.conveyor.orchestrator.repository.StepRunRepository;
import com.conveyor.orchestrator.repository.TriggerRecordRepository;
import com.conveyor.orchestrator.statemachine.InvalidTransitionException;
import com.conveyor.orchestrator.statemachine.PipelineRunState;
import com.conveyor.orchestrator.statemachine.StateMachineStore;
import com.conveyor.orchestrator.trigger.TriggerDeduplicator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

/**
 * Run lifecycle over in-memory stand-ins for the pipeline_runs, step_runs
 * and trigger_records tables, with the real deduplicator and state machines.
 */
@ExtendWith(MockitoExtension.class)
class PipelineRunServiceTest {

    @Mock PipelineRunRepository     runRepo;
    @Mock StepRunRepository         stepRunRepo;
    @Mock TriggerRecordRepository   triggerRepo;
    @Mock ApplicationEventPublisher events;

    final Map<UUID, PipelineRun>     runTable     = new HashMap<>();
    final List<StepRun>              stepTable    = new ArrayList<>();
    final Map<String, TriggerRecord> triggerTable = new ConcurrentHashMap<>();
    // Stand-in for row locks: held from findForUpdate until the caller "commits".
    final Map<String, ReentrantLock> rowLocks     = new ConcurrentHashMap<>();
    final CountDownLatch             bothInserted = new CountDownLatch(2);

    MutableClock clock;
    PipelineRunService runs;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T12:00:00Z");
        ObjectMapper json = new ObjectMapper().findAndRegisterModules();
        TriggerDeduplicator dedup = new TriggerDeduplicator(triggerRepo, clock, Duration.ofHours(1),
                new SimpleMeterRegistry());
        runs = new PipelineRunService(runRepo, stepRunRepo, dedup, new StateMachineStore(json, clock),
                json, events, clock);

        lenient().when(runRepo.save(any())).thenAnswer(inv -> {
            PipelineRun run = inv.getArgument(0);
            if (run.getId() == null) {
                ReflectionTestUtils.setField(run, "id", UUID.randomUUID());
            }
            runTable.put(run.getId(), run);
            return run;
        });
        lenient().when(runRepo.findById(any()))
                .thenAnswer(inv -> Optional.ofNullable(runTable.get(inv.<UUID>getArgument(0))));
        lenient().when(runRepo.findForUpdate(any()))
                .thenAnswer(inv -> Optional.ofNullable(runTable.get(inv.<UUID>getArgument(0))));

        lenient().when(stepRunRepo.save(any())).thenAnswer(inv -> {
            StepRun step = inv.getArgument(0);
            if (step.getId() == null) {
                ReflectionTestUtils.setField(step, "id", UUID.randomUUID());
                stepTable.add(step);
            }
            return step;
        });
        lenient().when(stepRunRepo.findByPipelineRunIdOrderByStepIndexAsc(any())).thenAnswer(inv ->
                stepTable.stream()
                        .filter(s -> s.getPipelineRunId().equals(inv.getArgument(0)))
                        .sorted(Comparator.comparingInt(StepRun::getStepIndex))
                        .toList());
        lenient().when(stepRunRepo.findByPipelineRunIdAndStepIndex(any(), anyInt())).thenAnswer(inv ->
                stepTable.stream()
                        .filter(s -> s.getPipelineRunId().equals(inv.getArgument(0))
                                && s.getStepIndex() == inv.<Integer>getArgument(1))
                        .findFirst());

        lenient().when(triggerRepo.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(triggerTable.get(inv.<String>getArgument(0))));
        lenient().when(triggerRepo.insertIfAbsent(anyString(), any(), any())).thenAnswer(inv -> {
            String key = inv.getArgument(0);
            TriggerRecord placeholder = new TriggerRecord(key, inv.getArgument(1), inv.getArgument(2));
            return triggerTable.putIfAbsent(key, placeholder) == null ? 1 : 0;
        });
        lenient().when(triggerRepo.findForUpdate(anyString())).thenAnswer(inv -> {
            String key = inv.getArgument(0);
            rowLocks.computeIfAbsent(key, k -> new ReentrantLock()).lock();
            return Optional.ofNullable(triggerTable.get(key));
        });
        lenient().when(triggerRepo.save(any())).thenAnswer(inv -> {
            TriggerRecord r = inv.getArgument(0);
            triggerTable.put(r.getTriggerKey(), r);
            return r;
        });
    }

    // ------------------------------------------------------------------
    // Triggering
    // ------------------------------------------------------------------

    @Test
    void trigger_admitted_createsPendingRunWithStepRuns() {
        TriggerOutcome outcome = runs.trigger(push(false, "build", "test"));

        assertThat(outcome.isDuplicate()).isFalse();
        PipelineRun run = outcome.run();
        assertThat(run.getStatus()).isEqualTo(PipelineRunState.PENDING);
        assertThat(run.getStepsTotal()).isEqualTo(2);
        assertThat(runs.steps(run.getId())).extracting(StepRun::getName).containsExactly("build", "test");
        verify(events).publishEvent(new RunAdmittedEvent(run.getId()));
    }

    @Test
    void trigger_sameCommitTwice_secondIsDuplicateOfFirst() {
        PipelineRun first = runs.trigger(push(false, "build")).run();
        clock.advance(Duration.ofMinutes(5));

        TriggerOutcome second = runs.trigger(push(false, "build"));

        assertThat(second.isDuplicate()).isTrue();
        assertThat(second.run()).isNull();
        assertThat(second.check().originalRunId()).isEqualTo(first.getId());
        assertThat(runTable).hasSize(1);
    }

    @Test
    void trigger_concurrentIdenticalTriggers_admitOnlyOne() throws Exception {
        // Both callers get past the upsert before either takes the row lock.
        lenient().doAnswer(inv -> {
            String key = inv.getArgument(0);
            TriggerRecord placeholder = new TriggerRecord(key, inv.getArgument(1), inv.getArgument(2));
            int inserted = triggerTable.putIfAbsent(key, placeholder) == null ? 1 : 0;
            bothInserted.countDown();
            bothInserted.await(5, TimeUnit.SECONDS);
            return inserted;
        }).when(triggerRepo).insertIfAbsent(anyString(), any(), any());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Callable<TriggerOutcome> trigger = () -> committing(() -> runs.trigger(push(false, "build")));
            Future<TriggerOutcome> a = pool.submit(trigger);
            Future<TriggerOutcome> b = pool.submit(trigger);
            List<TriggerOutcome> outcomes = List.of(a.get(10, TimeUnit.SECONDS), b.get(10, TimeUnit.SECONDS));

            assertThat(outcomes).filteredOn(o -> !o.isDuplicate()).hasSize(1);
            TriggerOutcome admitted = outcomes.stream().filter(o -> !o.isDuplicate()).findFirst().orElseThrow();
            TriggerOutcome duplicate = outcomes.stream().filter(TriggerOutcome::isDuplicate).findFirst().orElseThrow();
            assertThat(duplicate.check().originalRunId()).isEqualTo(admitted.run().getId());
            assertThat(runTable).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void trigger_forced_bypassesDeduplication() {
        runs.trigger(push(false, "build"));

        TriggerOutcome forced = runs.trigger(push(true, "build"));

        assertThat(forced.isDuplicate()).isFalse();
        assertThat(runTable).hasSize(2);
    }

    @Test
    void trigger_withoutSteps_isRejected() {
        assertThatThrownBy(() -> push(false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Progress
    // ------------------------------------------------------------------

    @Test
    void lastStepCompleted_runGoesCompletingThenCompleted() {
        UUID id = startedRun("build");

        runs.onStepStarted(id, 0);
        PipelineRun completing = runs.onStepCompleted(id, 0);
        assertThat(completing.getStatus()).isEqualTo(PipelineRunState.COMPLETING);

        PipelineRun done = runs.complete(id);
        assertThat(done.getStatus()).isEqualTo(PipelineRunState.COMPLETED);
        assertThat(runs.step(id, 0).getStatus()).isEqualTo(StepRunStatus.COMPLETED);
    }

    @Test
    void stepFailed_withStopPolicy_failsRunAndRecordsStep() {
        UUID id = startedRun("build", "test");
        runs.onStepStarted(id, 0);

        PipelineRun failed = runs.onStepFailed(id, 0, "exit code 2", "stop");

        assertThat(failed.getStatus()).isEqualTo(PipelineRunState.FAILED);
        assertThat(failed.getFailedStepName()).isEqualTo("build");
        assertThat(runs.step(id, 0).getError()).isEqualTo("exit code 2");
    }

    @Test
    void stepFailed_withNextPolicy_keepsRunning() {
        UUID id = startedRun("lint", "test");
        runs.onStepStarted(id, 0);

        PipelineRun run = runs.onStepFailed(id, 0, "warnings", "next");

        assertThat(run.getStatus()).isEqualTo(PipelineRunState.RUNNING);
    }

    // ------------------------------------------------------------------
    // Cancellation and re-runs
    // ------------------------------------------------------------------

    @Test
    void cancel_settlesOpenStepRuns() {
        UUID id = startedRun("build", "test");
        runs.onStepStarted(id, 0);

        PipelineRun cancelled = runs.cancel(id, "Cancelled by user");

        assertThat(cancelled.getStatus()).isEqualTo(PipelineRunState.CANCELLED);
        assertThat(runs.steps(id)).extracting(StepRun::getStatus)
                .containsOnly(StepRunStatus.CANCELLED);
    }

    @Test
    void cancel_completedRun_isInvalidTransition() {
        UUID id = startedRun("build");
        runs.onStepStarted(id, 0);
        runs.onStepCompleted(id, 0);
        runs.complete(id);

        assertThatThrownBy(() -> runs.cancel(id, "too late"))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void rerun_copiesStepsUnderDebugTrigger() {
        UUID id = startedRun("build", "test");
        runs.fail(id, "workspace setup failed");

        PipelineRun rerun = runs.rerun(id);

        assertThat(rerun.getId()).isNotEqualTo(id);
        assertThat(rerun.getTriggerType()).isEqualTo(PipelineRunService.DEBUG_TRIGGER);
        assertThat(runs.steps(rerun.getId())).extracting(StepRun::getName).containsExactly("build", "test");
        assertThat(runs.definitionOf(runs.step(rerun.getId(), 1)).name()).isEqualTo("test");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Run {@code work} as one transaction: row locks it took are released at the end. */
    private <T> T committing(Callable<T> work) throws Exception {
        try {
            return work.call();
        } finally {
            for (ReentrantLock lock : rowLocks.values()) {
                while (lock.isHeldByCurrentThread()) {
                    lock.unlock();
                }
            }
        }
    }

    private UUID startedRun(String... stepNames) {
        UUID id = runs.trigger(push(true, stepNames)).run().getId();
        runs.markPreparing(id);
        runs.markRunning(id);
        return id;
    }

    private static TriggerRequest push(boolean force, String... stepNames) {
        List<StepDefinition> steps = new ArrayList<>();
        for (String name : stepNames) {
            steps.add(StepDefinition.script(name, "make " + name));
        }
        return new TriggerRequest("ci", "web", "push", "main:abc123", steps, force);
    }
}
