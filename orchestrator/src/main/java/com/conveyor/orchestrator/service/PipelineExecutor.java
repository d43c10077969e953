package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.auth.StepTokenService;
import com.conveyor.orchestrator.debug.DebugSessionService;
import com.conveyor.orchestrator.driver.ContainerDriverClient;
import com.conveyor.orchestrator.driver.DriverException;
import com.conveyor.orchestrator.event.DebugResumedEvent;
import com.conveyor.orchestrator.event.RunAdmittedEvent;
import com.conveyor.orchestrator.event.RunCancelRequestedEvent;
import com.conveyor.orchestrator.event.StepActionEvent;
import com.conveyor.orchestrator.event.StepFinishedEvent;
import com.conveyor.orchestrator.event.StepRequeuedEvent;
import com.conveyor.orchestrator.execution.ExecutionConfig;
import com.conveyor.orchestrator.execution.ExecutionConfigBuilder;
import com.conveyor.orchestrator.execution.ExecutionKey;
import com.conveyor.orchestrator.execution.StepDefinition;
import com.conveyor.orchestrator.execution.StepExecutionService;
import com.conveyor.orchestrator.execution.StepPolicy;
import com.conveyor.orchestrator.model.PipelineRun;
import com.conveyor.orchestrator.model.StepExecution;
import com.conveyor.orchestrator.model.StepRun;
import com.conveyor.orchestrator.model.Workspace;
import com.conveyor.orchestrator.routing.ExecutionRouter;
import com.conveyor.orchestrator.routing.ExecutorType;
import com.conveyor.orchestrator.routing.RoutingDecision;
import com.conveyor.orchestrator.routing.RoutingException;
import com.conveyor.orchestrator.runner.QueuedJob;
import com.conveyor.orchestrator.runner.RemoteStepExecutor;
import com.conveyor.orchestrator.statemachine.InvalidTransitionException;
import com.conveyor.orchestrator.statemachine.PipelineRunState;
import com.conveyor.orchestrator.statemachine.PreconditionViolationException;
import com.conveyor.orchestrator.statemachine.StepExecutionState;
import com.conveyor.orchestrator.statemachine.WorkspaceState;
import com.conveyor.orchestrator.workspace.LockTimeoutException;
import com.conveyor.orchestrator.workspace.WorkspaceLockManager;
import com.conveyor.orchestrator.workspace.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Drives pipeline runs from admission to a terminal state.
 *
 * Steps run one after another. Each is routed, given an execution config
 * and a step token, and handed to the local worker pool or the remote job
 * queue. Results come back as {@link StepFinishedEvent}s and are applied
 * under a fair per-run lock, so callbacks for one run take effect in the
 * order they arrive.
 *
 * This class holds no transaction of its own: every service call it makes
 * commits on return.
 */
@Service
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final PipelineRunService        runs;
    private final StepExecutionService      executions;
    private final WorkspaceService          workspaces;
    private final WorkspaceLockManager      locks;
    private final ExecutionRouter           router;
    private final ExecutionConfigBuilder    configs;
    private final LocalStepExecutor         local;
    private final RemoteStepExecutor        remote;
    private final StepTokenService          tokens;
    private final DebugSessionService       debug;
    private final ContainerDriverClient     driver;
    private final ApplicationEventPublisher events;
    private final Clock                     clock;

    private final Map<UUID, RunLock> runLocks = new ConcurrentHashMap<>();

    public PipelineExecutor(PipelineRunService runs,
                            StepExecutionService executions,
                            WorkspaceService workspaces,
                            WorkspaceLockManager locks,
                            ExecutionRouter router,
                            ExecutionConfigBuilder configs,
                            LocalStepExecutor local,
                            RemoteStepExecutor remote,
                            StepTokenService tokens,
                            DebugSessionService debug,
                            ContainerDriverClient driver,
                            ApplicationEventPublisher events,
                            Clock clock) {
        this.runs       = runs;
        this.executions = executions;
        this.workspaces = workspaces;
        this.locks      = locks;
        this.router     = router;
        this.configs    = configs;
        this.local      = local;
        this.remote     = remote;
        this.tokens     = tokens;
        this.debug      = debug;
        this.driver     = driver;
        this.events     = events;
        this.clock      = clock;
    }

    // ------------------------------------------------------------------
    // Event entry points
    // ------------------------------------------------------------------

    @TransactionalEventListener(fallbackExecution = true)
    public void onRunAdmitted(RunAdmittedEvent event) {
        start(event.pipelineRunId());
    }

    @EventListener
    public void onStepFinished(StepFinishedEvent event) {
        onExecutionFinished(event.stepExecutionId(), event.exitCode(), event.error(), event.runnerId());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onStepRequeued(StepRequeuedEvent event) {
        redispatch(event.stepExecutionId());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onDebugResumed(DebugResumedEvent event) {
        withRunLock(event.pipelineRunId(), () -> {
            if (!runs.get(event.pipelineRunId()).getStatus().isTerminal()) {
                dispatch(event.pipelineRunId(), event.stepIndex(), null, false);
            }
        });
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onCancelRequested(RunCancelRequestedEvent event) {
        try {
            cancel(event.pipelineRunId(), event.reason());
        } catch (InvalidTransitionException e) {
            log.info("Run {} not cancelled: {}", event.pipelineRunId(), e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Run lifecycle
    // ------------------------------------------------------------------

    /** PENDING → PREPARING, create the workspace, → RUNNING, dispatch step 0. */
    public void start(UUID runId) {
        withRunLock(runId, () -> {
            try {
                runs.markPreparing(runId);
            } catch (InvalidTransitionException e) {
                log.info("Run {} not started: {}", runId, e.getMessage());
                return;
            }
            Workspace ws = workspaces.create(runId);
            if (ws.getStatus() == WorkspaceState.FAILED) {
                runs.fail(runId, "Workspace creation failed: " + ws.getError());
                finished(runId);
                return;
            }
            runs.markRunning(runId);
            dispatch(runId, 0, null, true);
        });
    }

    /**
     * Cancel a run: every unfinished attempt is cancelled and its container
     * or queued job stopped, workspace locks are dropped and the workspace
     * is cleaned.
     *
     * @throws InvalidTransitionException the run already finished
     */
    public PipelineRun cancel(UUID runId, String reason) {
        return callWithRunLock(runId, () -> {
            PipelineRun run = runs.cancel(runId, reason);
            for (StepExecution execution : executions.activeForRun(runId)) {
                cancelExecution(execution, reason);
            }
            int dropped = locks.forceRelease(Workspace.idFor(runId));
            if (dropped > 0) {
                log.warn("Force-released {} workspace lock(s) of cancelled run {}", dropped, runId);
            }
            finished(runId);
            return run;
        });
    }

    private void cancelExecution(StepExecution execution, String reason) {
        if (!executions.cancel(execution.getId(), reason)) {
            return;
        }
        tokens.revoke(execution.getExecutionKey());
        if (ExecutorType.REMOTE.name().equals(execution.getExecutorType()) || remote.isQueued(execution.getId())) {
            remote.cancel(execution.getId());
        } else if (execution.getContainerId() != null) {
            try {
                driver.stopContainer(execution.getContainerId());
            } catch (DriverException e) {
                log.warn("Could not stop container {} of {}: {}",
                        execution.getContainerId(), execution.getExecutionKey(), e.getMessage());
            }
        }
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    /**
     * Dispatch step {@code index}. Pauses instead if a debug session has a
     * breakpoint there.
     *
     * @param previousRunnerId runner the previous step ran on, for affinity
     * @param checkBreakpoint  false when resuming from the breakpoint itself
     */
    private void dispatch(UUID runId, int index, String previousRunnerId, boolean checkBreakpoint) {
        StepRun stepRun = runs.step(runId, index);
        if (checkBreakpoint && debug.pauseAtBreakpoint(runId, index, stepRun.getName())) {
            return;
        }
        StepExecution execution = executions.currentOrNextAttempt(stepRun);
        runs.onStepStarted(runId, index);
        submit(runId, stepRun, execution, previousRunnerId);
    }

    private void submit(UUID runId, StepRun stepRun, StepExecution execution, String previousRunnerId) {
        StepDefinition step = runs.definitionOf(stepRun);
        ExecutionKey key = ExecutionKey.parse(execution.getExecutionKey());

        RoutingDecision decision;
        ExecutionConfig config;
        try {
            decision = router.route(step.type(), step.config(), step.requirements(), previousRunnerId);
            Workspace ws = workspaces.find(Workspace.idFor(runId))
                    .orElseThrow(() -> NotFoundException.of("Workspace", Workspace.idFor(runId)));
            config = configs.build(step, decision, key, ws.getVolumeName(), tokens.issue(key.toString()));
        } catch (RoutingException | IllegalArgumentException e) {
            log.warn("Cannot dispatch {}: {}", key, e.getMessage());
            settle(execution.getId(), 1, e.getMessage(), null);
            return;
        }

        log.info("Dispatching {} ({}): {}", key, step.name(), decision.reason());
        if (decision.isLocal()) {
            local.submit(new LocalJob(execution.getId(), runId, stepRun.getStepIndex(),
                    Workspace.idFor(runId), config));
        } else {
            remote.submit(new QueuedJob(execution.getId(), runId, stepRun.getStepIndex(), step.name(),
                    decision.toRequirements(), config, clock.instant()));
        }
    }

    /**
     * Put a requeued attempt back into execution: remote jobs go back to
     * the head of the queue; anything else is routed again.
     */
    void redispatch(UUID executionId) {
        if (remote.resubmit(executionId)) {
            return;
        }
        StepExecution execution = executions.find(executionId)
                .orElseThrow(() -> NotFoundException.of("Step execution", executionId));
        UUID runId = execution.getPipelineRunId();
        withRunLock(runId, () -> {
            StepExecution current = executions.find(executionId).orElseThrow();
            if (current.getStatus() != StepExecutionState.PENDING
                    || runs.get(runId).getStatus() != PipelineRunState.RUNNING) {
                return;
            }
            StepRun stepRun = runs.step(runId, current.getStepIndex());
            tokens.revoke(current.getExecutionKey());
            submit(runId, stepRun, current, null);
        });
    }

    // ------------------------------------------------------------------
    // Results
    // ------------------------------------------------------------------

    void onExecutionFinished(UUID executionId, int exitCode, String error, String runnerId) {
        StepExecution execution = executions.find(executionId)
                .orElseThrow(() -> NotFoundException.of("Step execution", executionId));
        withRunLock(execution.getPipelineRunId(), () -> settle(executionId, exitCode, error, runnerId));
    }

    /**
     * Apply an attempt's result: retry, continue, stop or fail the run per
     * the step's policies. Called with the run lock held.
     */
    private void settle(UUID executionId, int exitCode, String error, String runnerId) {
        StepExecution before = executions.find(executionId).orElseThrow();
        tokens.revoke(before.getExecutionKey());
        if (before.getStatus().isTerminal()) {
            log.warn("Ignoring late result for {} ({})", before.getExecutionKey(), before.getStatus());
            if (runs.get(before.getPipelineRunId()).getStatus().isTerminal()) {
                // The cancelled step has let go of the workspace; clean it now.
                cleanupWorkspace(before.getPipelineRunId());
            }
            return;
        }
        StepExecution settled = executions.finish(executionId, exitCode, error);

        UUID runId = settled.getPipelineRunId();
        int index = settled.getStepIndex();
        PipelineRun run = runs.get(runId);
        if (run.getStatus().isTerminal()) {
            // Cancelled while the step ran.
            cleanupWorkspace(runId);
            return;
        }
        StepRun stepRun = runs.step(runId, index);
        StepDefinition step = runs.definitionOf(stepRun);

        if (settled.getStatus() == StepExecutionState.COMPLETED) {
            onStepSucceeded(runId, index, step, runnerId);
        } else if (settled.getAttempt() <= step.retries()) {
            log.warn("Step {} '{}' failed on attempt {}, retrying ({} retries)",
                    index, step.name(), settled.getAttempt(), step.retries());
            executions.nextAttempt(stepRun);
            dispatch(runId, index, null, false);
        } else {
            onStepFailed(runId, index, step, describe(settled, error));
        }
    }

    private void onStepSucceeded(UUID runId, int index, StepDefinition step, String runnerId) {
        StepPolicy policy = StepPolicy.parse(step.onSuccess());
        if (policy.isSideEffect()) {
            events.publishEvent(new StepActionEvent(runId, index, policy, true));
        }
        PipelineRun run = runs.onStepCompleted(runId, index);
        if (run.getStatus() == PipelineRunState.COMPLETING) {
            finish(runId);
        } else if (!policy.continuesAfterSuccess()) {
            runs.stopEarly(runId, "Stopped after step '" + step.name() + "' by on_success policy");
            finished(runId);
        } else {
            dispatch(runId, index + 1, runnerId, true);
        }
    }

    private void onStepFailed(UUID runId, int index, StepDefinition step, String error) {
        StepPolicy policy = StepPolicy.parse(step.onFailure());
        if (policy.isSideEffect()) {
            events.publishEvent(new StepActionEvent(runId, index, policy, false));
        }
        PipelineRun run = runs.onStepFailed(runId, index, error, step.onFailure());
        if (run.getStatus() == PipelineRunState.COMPLETING) {
            finish(runId);
        } else if (run.getStatus() == PipelineRunState.RUNNING) {
            dispatch(runId, index + 1, null, true);
        } else {
            log.info("Run {} failed at step {} '{}'", runId, index, step.name());
            finished(runId);
        }
    }

    /** COMPLETING → COMPLETED, then clean up. */
    private void finish(UUID runId) {
        runs.complete(runId);
        finished(runId);
    }

    private void finished(UUID runId) {
        cleanupWorkspace(runId);
        debug.onRunFinished(runId);
    }

    private void cleanupWorkspace(UUID runId) {
        String workspaceId = Workspace.idFor(runId);
        try {
            workspaces.cleanup(workspaceId);
        } catch (LockTimeoutException | PreconditionViolationException | InvalidTransitionException e) {
            log.warn("Workspace {} not cleaned now, the orphan sweep will retry: {}", workspaceId, e.getMessage());
        } catch (NotFoundException e) {
            log.debug("Run {} has no workspace to clean", runId);
        }
    }

    private static String describe(StepExecution execution, String error) {
        if (error != null && !error.isBlank()) {
            return error;
        }
        return "exit code " + execution.getExitCode();
    }

    // ------------------------------------------------------------------
    // Per-run ordering
    // ------------------------------------------------------------------

    private void withRunLock(UUID runId, Runnable action) {
        callWithRunLock(runId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Run {@code action} holding the run's lock. The map entry lives while
     * any thread holds or waits for it and is dropped by the last one out.
     */
    private <T> T callWithRunLock(UUID runId, Supplier<T> action) {
        RunLock lock = runLocks.compute(runId, (id, held) -> {
            RunLock l = held != null ? held : new RunLock();
            l.users++;
            return l;
        });
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
            runLocks.computeIfPresent(runId, (id, held) -> --held.users == 0 ? null : held);
        }
    }

    /** Fair lock plus a count of its holders and waiters, guarded by the map. */
    private static final class RunLock extends ReentrantLock {

        private int users;

        RunLock() {
            super(true);
        }
    }
}
