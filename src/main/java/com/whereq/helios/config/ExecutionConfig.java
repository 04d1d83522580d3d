package com.whereq.helios.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Shared clock and worker pool used by the governor and the scheduler, plus the housekeeping sweeps
 */
@Configuration
@EnableScheduling
public class ExecutionConfig {

    private static final int WORKER_QUEUE_CAPACITY = 100_000;

    @Bean
    public Clock heliosClock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool shared by all projects; its thread cap is the global concurrency ceiling.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler heliosWorkerScheduler(HeliosProperties properties) {
        return Schedulers.newBoundedElastic(
            properties.getScheduler().getGlobalConcurrency(),
            WORKER_QUEUE_CAPACITY,
            "helios-worker");
    }
}
