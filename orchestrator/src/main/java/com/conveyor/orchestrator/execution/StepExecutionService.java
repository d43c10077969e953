package com.conveyor.orchestrator.execution;

import com.conveyor.orchestrator.event.StateChangeEvent;
import com.conveyor.orchestrator.model.StepExecution;
import com.conveyor.orchestrator.model.StepRun;
import com.conveyor.orchestrator.repository.StepExecutionRepository;
import com.conveyor.orchestrator.repository.StepRunRepository;
import com.conveyor.orchestrator.routing.ExecutorType;
import com.conveyor.orchestrator.service.NotFoundException;
import com.conveyor.orchestrator.statemachine.StateMachineStore;
import com.conveyor.orchestrator.statemachine.StepExecutionState;
import com.conveyor.orchestrator.statemachine.StepStateMachine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Lifecycle of step execution attempts.
 *
 * {@link #getOrCreateExecution} is the only way a StepExecution row comes
 * into existence. Every state change loads the row under a write lock,
 * applies it through {@link StepStateMachine} and saves it back, so
 * completion, cancellation and recovery never interleave on one attempt.
 */
@Service
public class StepExecutionService {

    private static final Logger log = LoggerFactory.getLogger(StepExecutionService.class);

    static final Set<StepExecutionState> NON_TERMINAL = EnumSet.of(
            StepExecutionState.PENDING,
            StepExecutionState.PREPARING,
            StepExecutionState.RUNNING,
            StepExecutionState.COMPLETING);

    private final StepExecutionRepository   executionRepo;
    private final StepRunRepository         stepRunRepo;
    private final StateMachineStore         machines;
    private final ApplicationEventPublisher events;
    private final MeterRegistry             meters;
    private final Clock                     clock;

    public StepExecutionService(StepExecutionRepository executionRepo,
                                StepRunRepository stepRunRepo,
                                StateMachineStore machines,
                                ApplicationEventPublisher events,
                                MeterRegistry meters,
                                Clock clock) {
        this.executionRepo = executionRepo;
        this.stepRunRepo   = stepRunRepo;
        this.machines      = machines;
        this.events        = events;
        this.meters        = meters;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Return the execution for {@code executionKey}, creating it in PENDING
     * if it does not exist yet. Repeated calls with one key always return the
     * same row. The step run stays locked until commit, so a concurrent
     * call for another attempt of the same step waits and then sees this
     * one as active.
     *
     * @throws IllegalArgumentException the key is malformed or belongs to another step run
     * @throws IllegalStateException    the step run already has a different non-terminal attempt
     */
    @Transactional
    public StepExecution getOrCreateExecution(UUID stepRunId, String executionKey) {
        Optional<StepExecution> existing = executionRepo.findByExecutionKey(executionKey);
        if (existing.isPresent()) {
            return existing.get();
        }

        ExecutionKey key = ExecutionKey.parse(executionKey);
        StepRun stepRun = stepRunRepo.findForUpdate(stepRunId)
                .orElseThrow(() -> NotFoundException.of("Step run", stepRunId));
        if (!key.runId().equals(stepRun.getPipelineRunId().toString())
                || key.stepIndex() != stepRun.getStepIndex()) {
            throw new IllegalArgumentException(
                    "Execution key " + executionKey + " does not belong to step run " + stepRunId);
        }

        activeAttempt(stepRunId).ifPresent(active -> {
            throw new IllegalStateException("Step run " + stepRunId
                    + " already has an active execution " + active.getExecutionKey());
        });

        int inserted = executionRepo.insertIfAbsent(UUID.randomUUID(), executionKey, stepRunId,
                stepRun.getPipelineRunId(), key.stepIndex(), key.attempt(), clock.instant());
        StepExecution execution = executionRepo.findByExecutionKey(executionKey)
                .orElseThrow(() -> new IllegalStateException("Execution " + executionKey + " vanished after insert"));
        if (inserted > 0) {
            log.info("Created step execution {} (step run {})", executionKey, stepRunId);
        }
        return execution;
    }

    /**
     * The attempt a dispatch should use: the step run's active attempt if it
     * has one, otherwise a new attempt numbered one past the highest so far.
     */
    @Transactional
    public StepExecution currentOrNextAttempt(StepRun stepRun) {
        Optional<StepExecution> active = activeAttempt(stepRun.getId());
        if (active.isPresent()) {
            return active.get();
        }
        return nextAttempt(stepRun);
    }

    /** Create attempt max+1 for a retry. Earlier attempts are left untouched. */
    @Transactional
    public StepExecution nextAttempt(StepRun stepRun) {
        int attempt = executionRepo.findMaxAttempt(stepRun.getId()) + 1;
        ExecutionKey key = ExecutionKey.of(stepRun.getPipelineRunId(), stepRun.getStepIndex(), attempt);
        return getOrCreateExecution(stepRun.getId(), key.toString());
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /** PENDING → PREPARING, recording where the attempt is going. */
    @Transactional
    public StepExecution markPreparing(UUID executionId, ExecutorType executorType, String runnerId) {
        StepExecution execution = lock(executionId);
        StepStateMachine machine = machines.load(execution);
        machine.transition(StepExecutionState.PREPARING,
                runnerId != null ? "assigned to runner " + runnerId : "preparing " + executorType.name().toLowerCase());
        execution.setExecutorType(executorType.name());
        execution.setRunnerId(runnerId);
        return save(machine, execution);
    }

    /**
     * PREPARING → RUNNING. Starts the heartbeat clock. A repeated report for
     * an attempt that is already RUNNING leaves it as it is, only filling in
     * a container id that was not known yet.
     */
    @Transactional
    public StepExecution markRunning(UUID executionId, String containerId) {
        StepExecution execution = lock(executionId);
        if (execution.getStatus() == StepExecutionState.RUNNING) {
            if (containerId != null && execution.getContainerId() == null) {
                execution.setContainerId(containerId);
                return executionRepo.save(execution);
            }
            return execution;
        }
        StepStateMachine machine = machines.load(execution);
        machine.transition(StepExecutionState.RUNNING, containerId != null ? "container " + containerId : "acknowledged");
        Instant now = clock.instant();
        if (containerId != null) {
            execution.setContainerId(containerId);
        }
        execution.setStartedAt(now);
        execution.setHeartbeatAt(now);
        return save(machine, execution);
    }

    /**
     * Settle an attempt from its exit code. A late result for an attempt that
     * is already terminal (cancelled, or requeued and re-run) is ignored and
     * the row is returned unchanged.
     */
    @Transactional
    public StepExecution finish(UUID executionId, int exitCode, String error) {
        StepExecution execution = lock(executionId);
        StepStateMachine machine = machines.load(execution);
        if (machine.isTerminal()) {
            log.warn("Ignoring result for {} (exit {}): already {}",
                    execution.getExecutionKey(), exitCode, machine.getState());
            return execution;
        }
        if (machine.getState() == StepExecutionState.PENDING
                || machine.getState() == StepExecutionState.PREPARING) {
            // Never got to RUNNING, e.g. the container failed to start.
            machine.transition(StepExecutionState.FAILED, error != null ? error : "exit code " + exitCode);
        } else {
            machine.finish(exitCode, error);
        }
        execution.setExitCode(exitCode);
        execution.setError(exitCode == 0 ? null : error);
        execution.setCompletedAt(clock.instant());
        StepExecution saved = save(machine, execution);
        finishedCounter(saved.getStatus()).increment();
        log.info("Step execution {} finished: {} (exit {})",
                saved.getExecutionKey(), saved.getStatus(), exitCode);
        return saved;
    }

    /**
     * Cancel a non-terminal attempt. Returns false if it was already terminal.
     */
    @Transactional
    public boolean cancel(UUID executionId, String reason) {
        StepExecution execution = lock(executionId);
        StepStateMachine machine = machines.load(execution);
        if (!machine.canTransition(StepExecutionState.CANCELLED)) {
            return false;
        }
        machine.transition(StepExecutionState.CANCELLED, reason);
        execution.setCompletedAt(clock.instant());
        save(machine, execution);
        finishedCounter(StepExecutionState.CANCELLED).increment();
        log.info("Step execution {} cancelled: {}", execution.getExecutionKey(), reason);
        return true;
    }

    /**
     * Put a PREPARING or RUNNING attempt back to PENDING with no runner or
     * container. A second call on an already-requeued attempt is a no-op and
     * returns empty.
     */
    @Transactional
    public Optional<StepExecution> requeue(UUID executionId, String reason) {
        StepExecution execution = lock(executionId);
        StepStateMachine machine = machines.load(execution);
        if (!machine.getState().isActive()) {
            return Optional.empty();
        }
        machine.requeue(reason);
        execution.setRunnerId(null);
        execution.setContainerId(null);
        execution.setStartedAt(null);
        execution.setHeartbeatAt(null);
        log.warn("Step execution {} requeued: {}", execution.getExecutionKey(), reason);
        return Optional.of(save(machine, execution));
    }

    /** Record liveness for a running attempt. Returns false if it is not running. */
    @Transactional
    public boolean heartbeat(UUID executionId) {
        StepExecution execution = executionRepo.findById(executionId)
                .orElseThrow(() -> NotFoundException.of("Step execution", executionId));
        if (execution.getStatus() != StepExecutionState.RUNNING) {
            return false;
        }
        execution.setHeartbeatAt(clock.instant());
        executionRepo.save(execution);
        return true;
    }

    /** Append output lines to the step run the attempt belongs to. */
    @Transactional
    public void appendLogs(UUID executionId, List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        StepExecution execution = executionRepo.findById(executionId)
                .orElseThrow(() -> NotFoundException.of("Step execution", executionId));
        StepRun stepRun = stepRunRepo.findById(execution.getStepRunId())
                .orElseThrow(() -> NotFoundException.of("Step run", execution.getStepRunId()));
        stepRun.appendLogs(String.join("\n", lines) + "\n");
        stepRunRepo.save(stepRun);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<StepExecution> find(UUID executionId) {
        return executionRepo.findById(executionId);
    }

    @Transactional(readOnly = true)
    public Optional<StepExecution> findByKey(String executionKey) {
        return executionRepo.findByExecutionKey(executionKey);
    }

    @Transactional(readOnly = true)
    public List<StepExecution> forRun(UUID pipelineRunId) {
        return executionRepo.findByPipelineRunIdOrderByStepIndexAscAttemptAsc(pipelineRunId);
    }

    @Transactional(readOnly = true)
    public List<StepExecution> activeForRun(UUID pipelineRunId) {
        return executionRepo.findByPipelineRunIdAndStatusIn(pipelineRunId, NON_TERMINAL);
    }

    private Optional<StepExecution> activeAttempt(UUID stepRunId) {
        return executionRepo.findByStepRunIdOrderByAttemptAsc(stepRunId).stream()
                .filter(e -> NON_TERMINAL.contains(e.getStatus()))
                .findFirst();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StepExecution lock(UUID executionId) {
        return executionRepo.findForUpdate(executionId)
                .orElseThrow(() -> NotFoundException.of("Step execution", executionId));
    }

    private StepExecution save(StepStateMachine machine, StepExecution execution) {
        machines.store(machine, execution);
        StepExecution saved = executionRepo.save(execution);
        events.publishEvent(new StateChangeEvent("step_execution", saved.getExecutionKey(),
                saved.getStatus().name(), clock.instant()));
        return saved;
    }

    private Counter finishedCounter(StepExecutionState status) {
        return Counter.builder("conveyor.steps.finished")
                .tag("status", status.name().toLowerCase())
                .register(meters);
    }
}
