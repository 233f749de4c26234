package com.example.loankeeper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for job executions. The trigger loop only submits work here, so a long run never
 * delays the evaluation of other schedules.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "jobExecutor")
    public ThreadPoolTaskExecutor jobExecutor(SchedulerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // one worker per job type is enough, runs of the same type never overlap
        executor.setCorePoolSize(properties.getWorkerThreads());
        executor.setMaxPoolSize(properties.getWorkerThreads());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("loan-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
