package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.event.RunAdmittedEvent;
import com.conveyor.orchestrator.event.StateChangeEvent;
import com.conveyor.orchestrator.execution.StepDefinition;
import com.conveyor.orchestrator.model.PipelineRun;
import com.conveyor.orchestrator.model.StepRun;
import com.conveyor.orchestrator.model.StepRunStatus;
import com.conveyor.orchestrator.repository.PipelineRunRepository;
import com.conveyor.orchestrator.repository.StepRunRepository;
import com.conveyor.orchestrator.statemachine.PipelineRunState;
import com.conveyor.orchestrator.statemachine.PipelineStateMachine;
import com.conveyor.orchestrator.statemachine.StateMachineStore;
import com.conveyor.orchestrator.trigger.TriggerCheckResult;
import com.conveyor.orchestrator.trigger.TriggerDeduplicator;
import com.conveyor.orchestrator.trigger.TriggerKey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Pipeline run lifecycle.
 *
 * Every change loads the run under a row lock, applies it through
 * {@link PipelineStateMachine} and writes the machine back, so the state
 * column and the transition history never disagree. Step runs mirror their
 * step's progress for the API.
 */
@Service
public class PipelineRunService {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunService.class);

    public static final String DEBUG_TRIGGER = "debug";

    private final PipelineRunRepository     runRepo;
    private final StepRunRepository         stepRunRepo;
    private final TriggerDeduplicator       deduplicator;
    private final StateMachineStore         machines;
    private final ObjectMapper              json;
    private final ApplicationEventPublisher events;
    private final Clock                     clock;

    public PipelineRunService(PipelineRunRepository runRepo,
                              StepRunRepository stepRunRepo,
                              TriggerDeduplicator deduplicator,
                              StateMachineStore machines,
                              ObjectMapper objectMapper,
                              ApplicationEventPublisher events,
                              Clock clock) {
        this.runRepo      = runRepo;
        this.stepRunRepo  = stepRunRepo;
        this.deduplicator = deduplicator;
        this.machines     = machines;
        this.json         = objectMapper;
        this.events       = events;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Admit a trigger. A duplicate inside the dedup window creates nothing
     * and returns the original run id. An admitted trigger creates the run
     * in PENDING with one step run per step; execution starts once the
     * transaction commits. The trigger key's record stays locked until then,
     * so a concurrent identical trigger waits and comes back as a duplicate.
     */
    @Transactional
    public TriggerOutcome trigger(TriggerRequest request) {
        TriggerKey key = request.triggerKey();
        TriggerCheckResult check = deduplicator.admit(key, request.force());
        if (check.isDuplicate()) {
            return new TriggerOutcome(null, check);
        }
        PipelineRun run = createRun(request.pipelineId(), request.repoId(),
                request.triggerType(), request.triggerRef(), request.steps());
        deduplicator.record(key, run.getId());
        log.info("Run {} admitted for pipeline {} ({})", run.getId(), request.pipelineId(), key);
        return new TriggerOutcome(run, check);
    }

    /**
     * Re-run a failed or cancelled run with the same steps, bypassing
     * deduplication. Used by debug re-runs.
     */
    @Transactional
    public PipelineRun rerun(UUID originalRunId) {
        PipelineRun original = get(originalRunId);
        List<StepDefinition> steps = new ArrayList<>();
        for (StepRun stepRun : steps(originalRunId)) {
            steps.add(definitionOf(stepRun));
        }
        PipelineRun run = createRun(original.getPipelineId(), original.getRepoId(),
                DEBUG_TRIGGER, original.getTriggerRef(), steps);
        log.info("Run {} created as re-run of {}", run.getId(), originalRunId);
        return run;
    }

    private PipelineRun createRun(String pipelineId, String repoId, String triggerType,
                                  String triggerRef, List<StepDefinition> steps) {
        PipelineRun run = new PipelineRun(pipelineId, repoId, triggerType, triggerRef, steps.size());
        machines.store(new PipelineStateMachine(steps.size(), clock), run);
        run = runRepo.save(run);
        for (int i = 0; i < steps.size(); i++) {
            StepDefinition step = steps.get(i);
            stepRunRepo.save(new StepRun(run.getId(), i, step.name(), step.type(), write(step),
                    step.onSuccess(), step.onFailure(),
                    step.timeoutSeconds() == null ? 0 : step.timeoutSeconds()));
        }
        events.publishEvent(new RunAdmittedEvent(run.getId()));
        publish(run);
        return run;
    }

    // ------------------------------------------------------------------
    // Run transitions
    // ------------------------------------------------------------------

    @Transactional
    public PipelineRun markPreparing(UUID runId) {
        return update(runId, m -> m.transition(PipelineRunState.PREPARING, "preparing workspace"));
    }

    @Transactional
    public PipelineRun markRunning(UUID runId) {
        return update(runId, m -> m.transition(PipelineRunState.RUNNING, "workspace ready"));
    }

    @Transactional
    public PipelineRun onStepStarted(UUID runId, int index) {
        StepRun stepRun = step(runId, index);
        if (stepRun.getStatus() != StepRunStatus.RUNNING) {
            stepRun.setStatus(StepRunStatus.RUNNING);
            stepRun.setStartedAt(clock.instant());
            stepRun.setError(null);
            stepRunRepo.save(stepRun);
        }
        return update(runId, m -> m.onStepStarted(index, stepRun.getName()));
    }

    /** Record a successful step; the run moves to COMPLETING after the last one. */
    @Transactional
    public PipelineRun onStepCompleted(UUID runId, int index) {
        finishStepRun(runId, index, StepRunStatus.COMPLETED, null);
        return update(runId, m -> m.onStepCompleted(index));
    }

    /**
     * Record a failed step. With failure policy {@code next} the run keeps
     * going (or completes, if this was the last step); otherwise it fails.
     */
    @Transactional
    public PipelineRun onStepFailed(UUID runId, int index, String error, String onFailure) {
        StepRun stepRun = finishStepRun(runId, index, StepRunStatus.FAILED, error);
        return update(runId, m -> m.onStepFailed(index, stepRun.getName(), error, onFailure));
    }

    /** COMPLETING → COMPLETED. */
    @Transactional
    public PipelineRun complete(UUID runId) {
        return update(runId, m -> m.transition(PipelineRunState.COMPLETED, "finalized"));
    }

    /**
     * A step's on_success policy ended the run before its last step.
     * The remaining steps never run; the run completes.
     */
    @Transactional
    public PipelineRun stopEarly(UUID runId, String reason) {
        PipelineRun run = update(runId, m -> {
            m.transition(PipelineRunState.COMPLETING, reason);
            m.transition(PipelineRunState.COMPLETED, reason);
        });
        settleOpenStepRuns(runId, StepRunStatus.CANCELLED);
        return run;
    }

    @Transactional
    public PipelineRun fail(UUID runId, String reason) {
        PipelineRun run = update(runId, m -> m.fail(reason));
        settleOpenStepRuns(runId, StepRunStatus.CANCELLED);
        return run;
    }

    /**
     * @throws com.conveyor.orchestrator.statemachine.InvalidTransitionException the run already finished
     */
    @Transactional
    public PipelineRun cancel(UUID runId, String reason) {
        PipelineRun run = update(runId, m -> m.transition(PipelineRunState.CANCELLED, reason));
        settleOpenStepRuns(runId, StepRunStatus.CANCELLED);
        log.info("Run {} cancelled: {}", runId, reason);
        return run;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public PipelineRun get(UUID runId) {
        return runRepo.findById(runId).orElseThrow(() -> NotFoundException.of("Pipeline run", runId));
    }

    @Transactional(readOnly = true)
    public List<StepRun> steps(UUID runId) {
        return stepRunRepo.findByPipelineRunIdOrderByStepIndexAsc(runId);
    }

    @Transactional(readOnly = true)
    public StepRun step(UUID runId, int index) {
        return stepRunRepo.findByPipelineRunIdAndStepIndex(runId, index)
                .orElseThrow(() -> NotFoundException.of("Step " + index + " of run", runId));
    }

    public StepDefinition definitionOf(StepRun stepRun) {
        try {
            return json.readValue(stepRun.getDefinition(), StepDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable definition for step run " + stepRun.getId(), e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PipelineRun update(UUID runId, Consumer<PipelineStateMachine> change) {
        PipelineRun run = runRepo.findForUpdate(runId)
                .orElseThrow(() -> NotFoundException.of("Pipeline run", runId));
        PipelineRunState before = run.getStatus();
        PipelineStateMachine machine = machines.load(run);
        change.accept(machine);
        machines.store(machine, run);
        PipelineRun saved = runRepo.save(run);
        if (saved.getStatus() != before) {
            log.info("Run {} {} -> {}", runId, before, saved.getStatus());
            publish(saved);
        }
        return saved;
    }

    private StepRun finishStepRun(UUID runId, int index, StepRunStatus status, String error) {
        StepRun stepRun = step(runId, index);
        stepRun.setStatus(status);
        stepRun.setError(error);
        stepRun.setCompletedAt(clock.instant());
        return stepRunRepo.save(stepRun);
    }

    private void settleOpenStepRuns(UUID runId, StepRunStatus status) {
        for (StepRun stepRun : steps(runId)) {
            if (!stepRun.getStatus().isTerminal()) {
                stepRun.setStatus(status);
                stepRun.setCompletedAt(clock.instant());
                stepRunRepo.save(stepRun);
            }
        }
    }

    private void publish(PipelineRun run) {
        events.publishEvent(new StateChangeEvent("pipeline_run", run.getId().toString(),
                run.getStatus().name(), clock.instant()));
    }

    private String write(StepDefinition step) {
        try {
            return json.writeValueAsString(step);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable step definition " + step.name(), e);
        }
    }
}
