package com.openrangelabs.blacklist.collector.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Configuration for scheduled tasks.
 *
 * <p>The same pool drives the per-source tick loops and the maintenance jobs,
 * so its size should exceed the number of configured sources.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {

    @Value("${collector.scheduling.pool-size:10}")
    private int poolSize;

    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("collector-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(60);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
