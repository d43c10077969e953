package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.auth.StepTokenService;
import com.conveyor.orchestrator.debug.DebugSessionService;
import com.conveyor.orchestrator.trigger.TriggerDeduplicator;
import com.conveyor.orchestrator.workspace.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic housekeeping. Each pass is independent; one failing does not
 * stop the others.
 */
@Component
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final TriggerDeduplicator deduplicator;
    private final WorkspaceService    workspaces;
    private final StepTokenService    tokens;
    private final DebugSessionService debug;

    public MaintenanceScheduler(TriggerDeduplicator deduplicator,
                                WorkspaceService workspaces,
                                StepTokenService tokens,
                                DebugSessionService debug) {
        this.deduplicator = deduplicator;
        this.workspaces   = workspaces;
        this.tokens       = tokens;
        this.debug        = debug;
    }

    /** Paused debug sessions past their expiry; their runs get cancelled. */
    @Scheduled(fixedDelay = 30_000)
    public void expireDebugSessions() {
        guard("debug session expiry", debug::checkTimeouts);
    }

    @Scheduled(fixedDelay = 300_000, initialDelay = 60_000)
    public void cleanupTriggerRecords() {
        guard("trigger record cleanup", deduplicator::cleanupExpired);
    }

    @Scheduled(fixedDelay = 600_000, initialDelay = 120_000)
    public void cleanupOrphanedWorkspaces() {
        guard("orphaned workspace cleanup", workspaces::cleanupOrphans);
    }

    @Scheduled(fixedDelay = 3_600_000, initialDelay = 600_000)
    public void cleanupExpiredTokens() {
        guard("step token cleanup", tokens::cleanupExpired);
    }

    private static void guard(String pass, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Maintenance pass '{}' failed", pass, e);
        }
    }
}
