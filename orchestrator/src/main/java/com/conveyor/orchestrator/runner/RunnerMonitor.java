package com.conveyor.orchestrator.runner;

import com.conveyor.orchestrator.model.Runner;
import com.conveyor.orchestrator.recovery.JobRecoveryService;
import com.conveyor.orchestrator.runner.protocol.RunnerProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Declares runners dead once they have been silent for
 * {@link RunnerProtocol#DEATH_TIMEOUT}. The stale list is only a candidate
 * set; staleness is decided again under the runner's row lock.
 */
@Component
public class RunnerMonitor {

    private static final Logger log = LoggerFactory.getLogger(RunnerMonitor.class);

    private final RunnerRegistry     registry;
    private final RunnerConnections  connections;
    private final JobRecoveryService recovery;
    private final Clock              clock;

    public RunnerMonitor(RunnerRegistry registry,
                         RunnerConnections connections,
                         JobRecoveryService recovery,
                         Clock clock) {
        this.registry    = registry;
        this.connections = connections;
        this.recovery    = recovery;
        this.clock       = clock;
    }

    @Scheduled(fixedDelayString = "${conveyor.runner.monitor-interval-ms:10000}")
    public void sweep() {
        Instant cutoff = clock.instant().minus(RunnerProtocol.DEATH_TIMEOUT);
        for (Runner runner : registry.findStale(cutoff)) {
            try {
                if (recovery.onRunnerSilent(runner.getId(), cutoff)) {
                    connections.close(runner.getId(), 1001, "heartbeat timeout");
                }
            } catch (RuntimeException e) {
                log.error("Failed to recover runner {}", runner.getId(), e);
            }
        }
    }
}
