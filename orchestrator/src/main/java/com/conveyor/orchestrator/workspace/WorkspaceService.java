package com.conveyor.orchestrator.workspace;

import com.conveyor.orchestrator.driver.ContainerDriverClient;
import com.conveyor.orchestrator.driver.DriverException;
import com.conveyor.orchestrator.event.StateChangeEvent;
import com.conveyor.orchestrator.model.Workspace;
import com.conveyor.orchestrator.repository.WorkspaceRepository;
import com.conveyor.orchestrator.service.NotFoundException;
import com.conveyor.orchestrator.statemachine.InvalidTransitionException;
import com.conveyor.orchestrator.statemachine.PreconditionViolationException;
import com.conveyor.orchestrator.statemachine.StateMachineStore;
import com.conveyor.orchestrator.statemachine.WorkspaceState;
import com.conveyor.orchestrator.statemachine.WorkspaceStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Workspace volume lifecycle: create on PREPARING, acquire/release around
 * each step, clean up when the run is over.
 *
 * Create and cleanup run under an EXCLUSIVE lock; step execution holds a
 * SHARED lock (taken by the local step executor). The use count on the row
 * is the durable counterpart of those SHARED grants.
 */
@Service
public class WorkspaceService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceService.class);

    private final WorkspaceRepository       workspaceRepo;
    private final WorkspaceLockManager      locks;
    private final ContainerDriverClient     driver;
    private final StateMachineStore         machines;
    private final ApplicationEventPublisher events;
    private final Clock                     clock;
    private final Duration                  lockTimeout;
    private final Duration                  orphanThreshold;

    public WorkspaceService(WorkspaceRepository workspaceRepo,
                            WorkspaceLockManager locks,
                            ContainerDriverClient driver,
                            StateMachineStore machines,
                            ApplicationEventPublisher events,
                            Clock clock,
                            @Value("${conveyor.workspace.lock-timeout:PT5S}") Duration lockTimeout,
                            @Value("${conveyor.workspace.orphan-threshold:PT2H}") Duration orphanThreshold) {
        this.workspaceRepo   = workspaceRepo;
        this.locks           = locks;
        this.driver          = driver;
        this.machines        = machines;
        this.events          = events;
        this.clock           = clock;
        this.lockTimeout     = lockTimeout;
        this.orphanThreshold = orphanThreshold;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    /**
     * Create the workspace for a run. Calling it again for the same run
     * returns the existing row. A driver failure leaves the workspace FAILED
     * rather than throwing.
     */
    @Transactional
    public Workspace create(UUID pipelineRunId) {
        String id = Workspace.idFor(pipelineRunId);
        Optional<Workspace> existing = workspaceRepo.findById(id);
        if (existing.isPresent()) {
            return existing.get();
        }
        return locks.withLock(id, LockType.EXCLUSIVE, "create", lockTimeout, () -> {
            Workspace ws = new Workspace(id, pipelineRunId, "conveyor-" + id);
            WorkspaceStateMachine machine = new WorkspaceStateMachine(clock);
            try {
                driver.createVolume(ws.getVolumeName());
                machine.transition(WorkspaceState.READY, "volume created");
            } catch (DriverException e) {
                log.error("Workspace {} creation failed", id, e);
                machine.transition(WorkspaceState.FAILED, e.getMessage());
                ws.setError(e.getMessage());
            }
            return save(machine, ws);
        });
    }

    /** One more step execution is using the workspace. */
    @Transactional
    public Workspace acquire(String workspaceId, String reason) {
        Workspace ws = lock(workspaceId);
        WorkspaceStateMachine machine = machines.load(ws);
        machine.acquire(reason);
        return save(machine, ws);
    }

    /**
     * A step execution is done with the workspace.
     *
     * @throws PreconditionViolationException if the use count is already 0
     */
    @Transactional
    public Workspace release(String workspaceId, String reason) {
        Workspace ws = lock(workspaceId);
        WorkspaceStateMachine machine = machines.load(ws);
        machine.release(reason);
        return save(machine, ws);
    }

    /**
     * Delete the volume. Already-clean workspaces are returned unchanged.
     *
     * @throws PreconditionViolationException the workspace is still in use
     * @throws LockTimeoutException           another create or cleanup holds the lock
     */
    @Transactional
    public Workspace cleanup(String workspaceId) {
        return locks.withLock(workspaceId, LockType.EXCLUSIVE, "cleanup", lockTimeout, () -> {
            Workspace ws = lock(workspaceId);
            WorkspaceStateMachine machine = machines.load(ws);
            if (machine.getState() == WorkspaceState.CLEANED) {
                return ws;
            }
            return deleteVolume(ws, machine);
        });
    }

    /**
     * Clean every workspace that has sat idle in READY, CREATING or FAILED
     * for longer than the orphan threshold. Returns the ids cleaned.
     * Orphan status is checked again under the lock, so a workspace picked
     * up by a step since the sweep read it is left alone.
     */
    @Transactional
    public List<String> cleanupOrphans() {
        List<String> cleaned = new ArrayList<>();
        List<Workspace> candidates = workspaceRepo.findByStatusIn(
                EnumSet.of(WorkspaceState.READY, WorkspaceState.CREATING, WorkspaceState.FAILED));
        for (Workspace ws : candidates) {
            if (!machines.load(ws).isOrphaned(orphanThreshold)) {
                continue;
            }
            try {
                if (cleanupOrphan(ws.getId()).getStatus() == WorkspaceState.CLEANED) {
                    cleaned.add(ws.getId());
                }
            } catch (LockTimeoutException | PreconditionViolationException | InvalidTransitionException e) {
                log.warn("Skipping orphaned workspace {}: {}", ws.getId(), e.getMessage());
            }
        }
        if (!cleaned.isEmpty()) {
            log.info("Cleaned {} orphaned workspace(s)", cleaned.size());
        }
        return cleaned;
    }

    @Transactional(readOnly = true)
    public Optional<Workspace> find(String workspaceId) {
        return workspaceRepo.findById(workspaceId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Workspace cleanupOrphan(String workspaceId) {
        return locks.withLock(workspaceId, LockType.EXCLUSIVE, "orphan cleanup", lockTimeout, () -> {
            Workspace ws = lock(workspaceId);
            WorkspaceStateMachine machine = machines.load(ws);
            if (!machine.isOrphaned(orphanThreshold)) {
                return ws;
            }
            if (machine.getState() == WorkspaceState.CREATING) {
                // Creation never finished; CLEANING is only reachable through FAILED.
                machine.transition(WorkspaceState.FAILED, "creation abandoned");
            }
            return deleteVolume(ws, machine);
        });
    }

    private Workspace deleteVolume(Workspace ws, WorkspaceStateMachine machine) {
        machine.transition(WorkspaceState.CLEANING, "cleanup requested");
        try {
            driver.deleteVolume(ws.getVolumeName());
            machine.transition(WorkspaceState.CLEANED, "volume deleted");
            ws.setCleanedAt(clock.instant());
            log.info("Workspace {} cleaned", ws.getId());
        } catch (DriverException e) {
            log.warn("Workspace {} cleanup failed, will retry: {}", ws.getId(), e.getMessage());
            machine.transition(WorkspaceState.FAILED, e.getMessage());
            ws.setError(e.getMessage());
        }
        return save(machine, ws);
    }

    private Workspace lock(String workspaceId) {
        return workspaceRepo.findForUpdate(workspaceId)
                .orElseThrow(() -> NotFoundException.of("Workspace", workspaceId));
    }

    private Workspace save(WorkspaceStateMachine machine, Workspace ws) {
        machines.store(machine, ws);
        Workspace saved = workspaceRepo.save(ws);
        events.publishEvent(new StateChangeEvent("workspace", saved.getId(),
                saved.getStatus().name(), clock.instant()));
        return saved;
    }
}
