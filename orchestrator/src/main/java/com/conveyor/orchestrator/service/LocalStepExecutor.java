package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.driver.ContainerDriverClient;
import com.conveyor.orchestrator.driver.DriverException;
import com.conveyor.orchestrator.driver.dto.DriverEvent;
import com.conveyor.orchestrator.driver.dto.DriverResult;
import com.conveyor.orchestrator.event.StepFinishedEvent;
import com.conveyor.orchestrator.execution.StepExecutionService;
import com.conveyor.orchestrator.routing.ExecutorType;
import com.conveyor.orchestrator.statemachine.InvalidTransitionException;
import com.conveyor.orchestrator.workspace.LockType;
import com.conveyor.orchestrator.workspace.WorkspaceLock;
import com.conveyor.orchestrator.workspace.WorkspaceLockManager;
import com.conveyor.orchestrator.workspace.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs steps in containers on this host through the container driver.
 *
 * A fixed pool caps how many containers run at once. Each step holds a
 * SHARED workspace lock and one workspace use for the whole container run,
 * so cleanup (EXCLUSIVE) cannot start underneath it. The result is
 * published as a {@link StepFinishedEvent} after both are released.
 */
@Component
public class LocalStepExecutor {

    private static final Logger log = LoggerFactory.getLogger(LocalStepExecutor.class);

    private final ContainerDriverClient     driver;
    private final StepExecutionService      executions;
    private final WorkspaceService          workspaces;
    private final WorkspaceLockManager      locks;
    private final ApplicationEventPublisher events;
    private final ScheduledExecutorService  timers;
    private final Duration                  heartbeatInterval;
    private final ExecutorService           workers;

    public LocalStepExecutor(ContainerDriverClient driver,
                             StepExecutionService executions,
                             WorkspaceService workspaces,
                             WorkspaceLockManager locks,
                             ApplicationEventPublisher events,
                             ScheduledExecutorService timers,
                             @Value("${conveyor.steps.worker-count:4}") int workerCount,
                             @Value("${conveyor.steps.heartbeat-interval:PT10S}") Duration heartbeatInterval) {
        this.driver            = driver;
        this.executions        = executions;
        this.workspaces        = workspaces;
        this.locks             = locks;
        this.events            = events;
        this.timers            = timers;
        this.heartbeatInterval = heartbeatInterval;
        this.workers           = Executors.newFixedThreadPool(workerCount);
    }

    public void submit(LocalJob job) {
        workers.submit(() -> run(job));
    }

    void run(LocalJob job) {
        MDC.put("runId", job.pipelineRunId().toString());
        MDC.put("executionKey", job.config().executionKey());
        MDC.put("stepIndex", Integer.toString(job.stepIndex()));
        try {
            try {
                executions.markPreparing(job.stepExecutionId(), ExecutorType.LOCAL, null);
            } catch (InvalidTransitionException e) {
                log.info("Skipping {}: {}", job.config().executionKey(), e.getMessage());
                return;
            }
            StepFinishedEvent result = execute(job);
            events.publishEvent(result);
        } catch (RuntimeException e) {
            log.error("Unhandled error running {}: {}", job.config().executionKey(), e.getMessage(), e);
            events.publishEvent(new StepFinishedEvent(job.stepExecutionId(), 1,
                    "Unhandled exception: " + e.getMessage(), null));
        } finally {
            MDC.clear();
        }
    }

    private StepFinishedEvent execute(LocalJob job) {
        String key = job.config().executionKey();
        WorkspaceLock lock = locks.acquire(job.workspaceId(), LockType.SHARED,
                "step " + key, workspaces.getLockTimeout());
        if (!lock.acquired()) {
            return new StepFinishedEvent(job.stepExecutionId(), 1,
                    "Timed out waiting for workspace " + job.workspaceId(), null);
        }
        Heartbeat[] heartbeat = new Heartbeat[1];
        try {
            workspaces.acquire(job.workspaceId(), "step " + key);
            try {
                DriverResult result = driver.executeStep(job.config(), event -> {
                    if (event.isStatus() && "running".equals(event.status()) && heartbeat[0] == null) {
                        executions.markRunning(job.stepExecutionId(), event.containerId());
                        heartbeat[0] = new Heartbeat(job);
                        heartbeat[0].start();
                    } else if (event.isLog() && event.line() != null) {
                        executions.appendLogs(job.stepExecutionId(), List.of(event.line()));
                    }
                });
                log.info("Step {} exited with {}", key, result.exitCode());
                return new StepFinishedEvent(job.stepExecutionId(), result.exitCode(), result.error(), null);
            } catch (DriverException e) {
                log.error("Container driver failed for {}", key, e);
                return new StepFinishedEvent(job.stepExecutionId(), 1,
                        "Container driver error: " + e.getMessage(), null);
            } finally {
                if (heartbeat[0] != null) {
                    heartbeat[0].stop();
                }
                releaseWorkspace(job.workspaceId(), key);
            }
        } finally {
            locks.release(lock);
        }
    }

    private void releaseWorkspace(String workspaceId, String key) {
        try {
            workspaces.release(workspaceId, "step " + key);
        } catch (RuntimeException e) {
            log.error("Failed to release workspace {} after {}", workspaceId, key, e);
        }
    }

    /**
     * Periodic liveness for one running container. {@link #stop} waits for a
     * beat already in progress, and no beat runs after it returns.
     */
    private final class Heartbeat {

        private final LocalJob      job;
        private final ReentrantLock lock = new ReentrantLock();
        private boolean             stopped;
        private ScheduledFuture<?>  future;

        Heartbeat(LocalJob job) {
            this.job = job;
        }

        void start() {
            long every = heartbeatInterval.toMillis();
            future = timers.scheduleAtFixedRate(this::beat, every, every, TimeUnit.MILLISECONDS);
        }

        void stop() {
            if (future != null) {
                future.cancel(false);
            }
            lock.lock();
            try {
                stopped = true;
            } finally {
                lock.unlock();
            }
        }

        private void beat() {
            lock.lock();
            try {
                if (!stopped) {
                    executions.heartbeat(job.stepExecutionId());
                }
            } catch (RuntimeException e) {
                log.warn("Heartbeat for {} failed: {}", job.config().executionKey(), e.getMessage());
            } finally {
                lock.unlock();
            }
        }
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }
}
