package com.conveyor.orchestrator.recovery;

import com.conveyor.orchestrator.event.StepRequeuedEvent;
import com.conveyor.orchestrator.execution.StepExecutionService;
import com.conveyor.orchestrator.model.Runner;
import com.conveyor.orchestrator.model.RunnerStatus;
import com.conveyor.orchestrator.model.StepExecution;
import com.conveyor.orchestrator.repository.RunnerRepository;
import com.conveyor.orchestrator.repository.StepExecutionRepository;
import com.conveyor.orchestrator.runner.protocol.RunnerProtocol;
import com.conveyor.orchestrator.statemachine.StepExecutionState;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Repairs step executions that lost their executor.
 *
 * All three entry points are idempotent and work from the database rows
 * under row locks, so when death detection and a reconnect race for the
 * same runner, whichever commits first decides what the other sees.
 * Requeued executions are announced with {@link StepRequeuedEvent}; the
 * dispatcher puts them back in line after the transaction commits.
 */
@Service
public class JobRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(JobRecoveryService.class);

    private static final Set<StepExecutionState> ACTIVE =
            EnumSet.of(StepExecutionState.PREPARING, StepExecutionState.RUNNING);

    private final RunnerRepository          runnerRepo;
    private final StepExecutionRepository   executionRepo;
    private final StepExecutionService      executions;
    private final ApplicationEventPublisher events;
    private final MeterRegistry             meters;
    private final Clock                     clock;

    public JobRecoveryService(RunnerRepository runnerRepo,
                              StepExecutionRepository executionRepo,
                              StepExecutionService executions,
                              ApplicationEventPublisher events,
                              MeterRegistry meters,
                              Clock clock) {
        this.runnerRepo    = runnerRepo;
        this.executionRepo = executionRepo;
        this.executions    = executions;
        this.events        = events;
        this.meters        = meters;
        this.clock         = clock;
    }

    /**
     * A runner missed an ACK or was otherwise found dead. Requeue whatever it
     * was running and mark it dead. Returns the executions that were requeued;
     * a repeated call returns an empty list.
     */
    @Transactional
    public List<StepExecution> onRunnerDeath(String runnerId) {
        Optional<Runner> found = runnerRepo.findForUpdate(runnerId);
        if (found.isEmpty()) {
            log.warn("Death reported for unknown runner {}", runnerId);
            return List.of();
        }
        return declareDead(found.get());
    }

    /**
     * The monitor saw the runner silent since before {@code cutoff}. The
     * heartbeat is checked again under the row lock: a runner that
     * re-registered or heartbeated after the monitor's read keeps its step.
     *
     * @return true if the runner was declared dead by this call
     */
    @Transactional
    public boolean onRunnerSilent(String runnerId, Instant cutoff) {
        Optional<Runner> found = runnerRepo.findForUpdate(runnerId);
        if (found.isEmpty() || found.get().getStatus() == RunnerStatus.DEAD) {
            return false;
        }
        Runner runner = found.get();
        Instant last = runner.getLastHeartbeatAt();
        if (last != null && !last.isBefore(cutoff)) {
            log.info("Runner {} heartbeated at {} since the death sweep read it, leaving it {}",
                    runnerId, last, runner.getStatus());
            return false;
        }
        declareDead(runner);
        return true;
    }

    /**
     * A runner re-registered. Tell it whether to continue the step it
     * remembers, abort it, or go idle.
     */
    @Transactional
    public ReconnectAction onRunnerReconnect(String runnerId) {
        Optional<Runner> found = runnerRepo.findForUpdate(runnerId);
        if (found.isEmpty() || found.get().getCurrentStepExecutionId() == null) {
            return ReconnectAction.IDLE;
        }
        Runner runner = found.get();
        UUID stepId = runner.getCurrentStepExecutionId();

        Optional<StepExecution> execution = executionRepo.findById(stepId);
        if (execution.isEmpty()) {
            log.warn("Runner {} remembers unknown step {}, clearing", runnerId, stepId);
            clearAssignment(runner);
            return ReconnectAction.IDLE;
        }

        StepExecution e = execution.get();
        boolean stillOurs = runnerId.equals(e.getRunnerId())
                && (ACTIVE.contains(e.getStatus()) || e.getStatus() == StepExecutionState.COMPLETING);
        if (stillOurs) {
            runner.setStatus(RunnerStatus.BUSY);
            runnerRepo.save(runner);
            log.info("Runner {} reconnected, continuing {}", runnerId, e.getExecutionKey());
            return ReconnectAction.CONTINUE;
        }

        log.info("Runner {} reconnected but {} is now {} (runner={}), aborting",
                runnerId, e.getExecutionKey(), e.getStatus(), e.getRunnerId());
        clearAssignment(runner);
        return ReconnectAction.ABORT;
    }

    /**
     * Startup scan: requeue PREPARING and RUNNING executions that no live
     * executor owns. An execution is orphaned when it has no runner (local
     * work does not survive a backend restart), or its runner is missing,
     * not alive, or silent for longer than the death timeout.
     *
     * Only safe before local workers start, i.e. at startup.
     */
    @Transactional
    public List<StepExecution> recoverOrphanedSteps() {
        Instant cutoff = clock.instant().minus(RunnerProtocol.DEATH_TIMEOUT);
        List<StepExecution> recovered = new ArrayList<>();
        for (StepExecution e : executionRepo.findByStatusIn(ACTIVE)) {
            Optional<String> why = orphanReason(e, cutoff);
            if (why.isPresent()) {
                requeue(e.getId(), why.get()).ifPresent(recovered::add);
            }
        }
        if (!recovered.isEmpty()) {
            log.warn("Recovered {} orphaned step execution(s)", recovered.size());
        }
        return recovered;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<StepExecution> declareDead(Runner runner) {
        String runnerId = runner.getId();
        Set<UUID> held = new LinkedHashSet<>();
        if (runner.getCurrentStepExecutionId() != null) {
            held.add(runner.getCurrentStepExecutionId());
        }
        executionRepo.findByRunnerIdAndStatusIn(runnerId, ACTIVE)
                .forEach(e -> held.add(e.getId()));

        List<StepExecution> requeued = new ArrayList<>();
        for (UUID executionId : held) {
            requeue(executionId, "runner " + runnerId + " died").ifPresent(requeued::add);
        }

        if (runner.getStatus() != RunnerStatus.DEAD) {
            log.warn("Runner {} declared dead (last heartbeat {}), requeued {} step(s)",
                    runnerId, runner.getLastHeartbeatAt(), requeued.size());
        }
        runner.setStatus(RunnerStatus.DEAD);
        runner.setCurrentStepExecutionId(null);
        runnerRepo.save(runner);
        return requeued;
    }

    private Optional<String> orphanReason(StepExecution e, Instant cutoff) {
        if (e.getRunnerId() == null) {
            return Optional.of("no executor after restart");
        }
        Optional<Runner> runner = runnerRepo.findById(e.getRunnerId());
        if (runner.isEmpty()) {
            return Optional.of("runner " + e.getRunnerId() + " no longer registered");
        }
        Runner r = runner.get();
        if (!r.getStatus().isAlive()) {
            return Optional.of("runner " + r.getId() + " is " + r.getStatus());
        }
        if (r.getLastHeartbeatAt() == null || r.getLastHeartbeatAt().isBefore(cutoff)) {
            return Optional.of("runner " + r.getId() + " silent since " + r.getLastHeartbeatAt());
        }
        return Optional.empty();
    }

    private Optional<StepExecution> requeue(UUID executionId, String reason) {
        Optional<StepExecution> requeued = executions.requeue(executionId, reason);
        requeued.ifPresent(e -> {
            meters.counter("conveyor.recovery.requeued").increment();
            events.publishEvent(new StepRequeuedEvent(e.getId(), reason));
        });
        return requeued;
    }

    private void clearAssignment(Runner runner) {
        runner.setCurrentStepExecutionId(null);
        if (runner.getStatus().isAlive()) {
            runner.setStatus(RunnerStatus.IDLE);
        }
        runnerRepo.save(runner);
    }
}
