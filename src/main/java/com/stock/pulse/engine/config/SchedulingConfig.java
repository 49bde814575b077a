package com.stock.pulse.engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Threads for the periodic trigger and for running extraction jobs off the request thread.
 */
@Configuration
public class SchedulingConfig {

    public static final String JOB_EXECUTOR = "pipelineJobExecutor";

    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("pipeline-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    // one job at a time; the orchestrator rejects overlapping triggers before submitting
    @Bean(name = JOB_EXECUTOR)
    public ThreadPoolTaskExecutor pipelineJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(4);
        executor.setThreadNamePrefix("pipeline-job-");
        executor.initialize();
        return executor;
    }
}
