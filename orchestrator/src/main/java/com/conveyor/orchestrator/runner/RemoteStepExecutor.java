package com.conveyor.orchestrator.runner;

import com.conveyor.orchestrator.event.StepFinishedEvent;
import com.conveyor.orchestrator.execution.StepExecutionService;
import com.conveyor.orchestrator.model.Runner;
import com.conveyor.orchestrator.model.StepExecution;
import com.conveyor.orchestrator.recovery.JobRecoveryService;
import com.conveyor.orchestrator.routing.ExecutorType;
import com.conveyor.orchestrator.routing.RunnerLabels;
import com.conveyor.orchestrator.runner.protocol.RunnerProtocol;
import com.conveyor.orchestrator.statemachine.InvalidTransitionException;
import com.conveyor.orchestrator.statemachine.StepExecutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Hands queued remote jobs to runners.
 *
 * Websocket runners are pushed an execute_step and must ACK it within
 * {@link RunnerProtocol#ACK_TIMEOUT}; a missed ACK declares the runner dead
 * and the job goes back to the head of the queue. HTTP runners poll through
 * {@link #pollJob}; handing them the job counts as delivery.
 *
 * Results are published as {@link StepFinishedEvent}s.
 */
@Component
public class RemoteStepExecutor {

    private static final Logger log = LoggerFactory.getLogger(RemoteStepExecutor.class);

    private final JobQueue                  queue;
    private final RunnerRegistry            registry;
    private final RunnerConnections         connections;
    private final RunnerProtocol            protocol;
    private final StepExecutionService      executions;
    private final JobRecoveryService        recovery;
    private final ApplicationEventPublisher events;
    private final ScheduledExecutorService  timers;

    // stepExecutionId -> pending ACK timer
    private final Map<UUID, ScheduledFuture<?>> ackTimers = new ConcurrentHashMap<>();

    public RemoteStepExecutor(JobQueue queue,
                              RunnerRegistry registry,
                              RunnerConnections connections,
                              RunnerProtocol protocol,
                              StepExecutionService executions,
                              JobRecoveryService recovery,
                              ApplicationEventPublisher events,
                              ScheduledExecutorService timers) {
        this.queue       = queue;
        this.registry    = registry;
        this.connections = connections;
        this.protocol    = protocol;
        this.executions  = executions;
        this.recovery    = recovery;
        this.events      = events;
        this.timers      = timers;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /** Queue a job and offer it to whichever connected runner can take it. */
    public void submit(QueuedJob job) {
        queue.enqueue(job);
        offerWork();
    }

    /** Put a requeued job back at the head of the queue and offer it again. */
    public boolean resubmit(UUID stepExecutionId) {
        boolean requeued = queue.requeue(stepExecutionId);
        if (requeued) {
            offerWork();
        }
        return requeued;
    }

    /** Drop a job, waiting or in flight. A late result for it is ignored. */
    public void cancel(UUID stepExecutionId) {
        cancelAckTimer(stepExecutionId);
        queue.cancel(stepExecutionId).ifPresent(job ->
                log.info("Cancelled remote job {}", job.executionKey()));
    }

    public boolean isQueued(UUID stepExecutionId) {
        return queue.get(stepExecutionId).isPresent();
    }

    /** Try to hand waiting work to every connected idle runner. */
    public void offerWork() {
        for (String runnerId : connections.connectedRunners()) {
            if (queue.size() == 0) {
                return;
            }
            offerWork(runnerId);
        }
    }

    /** Push the next matching job, if any, to one websocket runner. */
    public void offerWork(String runnerId) {
        Optional<QueuedJob> assigned = assignNext(runnerId);
        if (assigned.isEmpty()) {
            return;
        }
        QueuedJob job = assigned.get();
        if (!connections.send(runnerId, protocol.executeStep(job.stepExecutionId(), job.config()))) {
            log.warn("Could not deliver {} to runner {}", job.executionKey(), runnerId);
            recovery.onRunnerDeath(runnerId);
            return;
        }
        UUID stepId = job.stepExecutionId();
        ackTimers.put(stepId, timers.schedule(() -> onAckTimeout(runnerId, stepId),
                RunnerProtocol.ACK_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        log.info("Sent {} to runner {}", job.executionKey(), runnerId);
    }

    /**
     * HTTP poll: assign the next matching job and mark it running right away.
     * Empty when the runner is busy, unknown, or nothing matches.
     */
    public Optional<QueuedJob> pollJob(String runnerId) {
        Optional<QueuedJob> assigned = assignNext(runnerId);
        assigned.ifPresent(job -> executions.markRunning(job.stepExecutionId(), null));
        return assigned;
    }

    /**
     * Take the oldest queued job this runner can run and assign it: the
     * execution goes to PREPARING on the runner and the runner to BUSY.
     * Jobs whose execution was cancelled meanwhile are dropped.
     */
    synchronized Optional<QueuedJob> assignNext(String runnerId) {
        Optional<Runner> found = registry.find(runnerId);
        if (found.isEmpty() || !found.get().getStatus().isAlive()
                || found.get().getCurrentStepExecutionId() != null) {
            return Optional.empty();
        }
        RunnerLabels labels = registry.labelsOf(found.get());

        while (true) {
            QueuedJob job = queue.dequeueMatching(j -> matches(j, runnerId, labels));
            if (job == null) {
                return Optional.empty();
            }
            try {
                executions.markPreparing(job.stepExecutionId(), ExecutorType.REMOTE, runnerId);
            } catch (InvalidTransitionException e) {
                log.info("Dropping queued job {}: {}", job.executionKey(), e.getMessage());
                queue.complete(job.stepExecutionId());
                continue;
            }
            registry.assign(runnerId, job.stepExecutionId());
            return Optional.of(job);
        }
    }

    static boolean matches(QueuedJob job, String runnerId, RunnerLabels labels) {
        String pinned = job.requirements().runnerId();
        if (pinned != null && !pinned.equals(runnerId)) {
            return false;
        }
        return labels.satisfies(job.requirements());
    }

    // ------------------------------------------------------------------
    // Runner callbacks
    // ------------------------------------------------------------------

    public void onAck(String runnerId, UUID stepId) {
        cancelAckTimer(stepId);
        try {
            executions.markRunning(stepId, null);
            log.info("Runner {} acknowledged step {}", runnerId, stepId);
        } catch (InvalidTransitionException e) {
            log.warn("Late ACK from runner {} for step {}: {}", runnerId, stepId, e.getMessage());
        }
    }

    /**
     * A runner reported a result. Results from a runner that no longer owns
     * the attempt (it was requeued after the runner was declared dead) are
     * dropped.
     */
    public void onStepComplete(String runnerId, UUID stepId, int exitCode, String error) {
        cancelAckTimer(stepId);
        Optional<StepExecution> found = executions.find(stepId);
        if (found.isEmpty() || !runnerId.equals(found.get().getRunnerId())) {
            log.warn("Ignoring result for step {} from runner {}: not its assignment", stepId, runnerId);
            registry.find(runnerId)
                    .filter(r -> stepId.equals(r.getCurrentStepExecutionId()))
                    .ifPresent(r -> registry.markIdle(runnerId));
            return;
        }
        if (found.get().getStatus() == StepExecutionState.PREPARING) {
            // Result arrived before (or instead of) the ACK.
            executions.markRunning(stepId, null);
        }
        queue.complete(stepId);
        registry.markIdle(runnerId);
        events.publishEvent(new StepFinishedEvent(stepId, exitCode, error, runnerId));
        offerWork(runnerId);
    }

    private void onAckTimeout(String runnerId, UUID stepId) {
        if (ackTimers.remove(stepId) == null) {
            return;
        }
        log.warn("Runner {} did not acknowledge step {} within {}s",
                runnerId, stepId, RunnerProtocol.ACK_TIMEOUT.toSeconds());
        try {
            recovery.onRunnerDeath(runnerId);
            connections.close(runnerId, RunnerConnections.ACK_TIMEOUT, "ack timeout");
        } catch (RuntimeException e) {
            log.error("ACK timeout handling for runner {} failed", runnerId, e);
        }
    }

    private void cancelAckTimer(UUID stepId) {
        ScheduledFuture<?> timer = ackTimers.remove(stepId);
        if (timer != null) {
            timer.cancel(false);
        }
    }
}
