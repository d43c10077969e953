package com.conveyor.orchestrator.recovery;

import com.conveyor.orchestrator.model.StepExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the orphan scan once the application is up, before runners have had
 * a chance to reconnect and before any local worker starts a step.
 */
@Component
public class StartupRecovery {

    private static final Logger log = LoggerFactory.getLogger(StartupRecovery.class);

    private final JobRecoveryService recovery;

    public StartupRecovery(JobRecoveryService recovery) {
        this.recovery = recovery;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        List<StepExecution> recovered = recovery.recoverOrphanedSteps();
        log.info("Startup recovery complete: {} step execution(s) requeued", recovered.size());
    }
}
