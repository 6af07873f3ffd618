package com.casegovernor.context;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledFuture;

/** Periodically drops expired cache entries that are never read again. */
@Component
public class ContextStoreSweeper {

    private static final Logger log = LoggerFactory.getLogger(ContextStoreSweeper.class);

    private final ContextStore contextStore;
    private final ContextStoreProperties properties;
    private final TaskScheduler scheduler;
    private ScheduledFuture<?> task;

    public ContextStoreSweeper(ContextStore contextStore, ContextStoreProperties properties, TaskScheduler scheduler) {
        this.contextStore = contextStore;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    @PostConstruct
    void start() {
        task = scheduler.scheduleWithFixedDelay(this::sweep, properties.sweepInterval());
        log.info("Cache sweep scheduled interval={}", properties.sweepInterval());
    }

    @PreDestroy
    void stop() {
        if (task != null) {
            task.cancel(false);
        }
    }

    void sweep() {
        try {
            contextStore.evictExpired();
        } catch (RuntimeException ex) {
            log.warn("Cache sweep failed: {}", ex.getMessage(), ex);
        }
    }
}
