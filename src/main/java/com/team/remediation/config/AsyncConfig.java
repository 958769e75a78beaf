package com.team.remediation.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Executor for workflow runs and the shared clock.
 * Runs never hold a worker while waiting for approval, so a small pool serves many runs.
 */
@Configuration
public class AsyncConfig {

    @Value("${workflow.executor.core-pool-size:4}")
    private int corePoolSize;

    @Value("${workflow.executor.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${workflow.executor.queue-capacity:200}")
    private int queueCapacity;

    @Bean(name = "aiTaskExecutor")
    public ThreadPoolTaskExecutor aiTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("remediation-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
