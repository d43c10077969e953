package com.conveyor.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class AppConfig {

    /** Every time-dependent component reads time from here, so tests can pin it. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Short timers: runner registration and ACK deadlines, step heartbeats.
     * Tasks on it must not block.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService conveyorTimers() {
        return Executors.newScheduledThreadPool(2);
    }
}
