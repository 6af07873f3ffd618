package com.casegovernor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Shared infrastructure: the time source and the thread pools.
 *
 * Page builds and related-record fetches run on separate pools so a build waiting
 * on its fetches can never starve them of threads.
 */
@Configuration
public class GovernorConfiguration {

    public static final String BUILD_EXECUTOR = "governorBuildExecutor";
    public static final String FETCH_EXECUTOR = "governorFetchExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = BUILD_EXECUTOR)
    public ThreadPoolTaskExecutor governorBuildExecutor(ExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.corePoolSize());
        executor.setMaxPoolSize(properties.maxPoolSize());
        executor.setQueueCapacity(properties.queueCapacity());
        executor.setThreadNamePrefix("governor-build-");
        return executor;
    }

    @Bean(name = FETCH_EXECUTOR)
    public ThreadPoolTaskExecutor governorFetchExecutor(ExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.fetchPoolSize());
        executor.setMaxPoolSize(properties.fetchPoolSize());
        executor.setThreadNamePrefix("governor-fetch-");
        return executor;
    }

    @Bean
    public ThreadPoolTaskScheduler governorTaskScheduler(ExecutorProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.schedulerPoolSize());
        scheduler.setThreadNamePrefix("governor-wait-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
