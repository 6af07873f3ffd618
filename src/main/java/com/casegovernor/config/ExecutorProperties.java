package com.casegovernor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pool sizes for the aggregation executors and the consumer wait-timer scheduler.
 */
@ConfigurationProperties(prefix = "governor.executor")
public record ExecutorProperties(
    Integer corePoolSize,
    Integer maxPoolSize,
    Integer queueCapacity,
    Integer fetchPoolSize,
    Integer schedulerPoolSize
) {

    public ExecutorProperties {
        corePoolSize = corePoolSize == null ? 4 : corePoolSize;
        maxPoolSize = maxPoolSize == null ? Math.max(16, corePoolSize) : maxPoolSize;
        queueCapacity = queueCapacity == null ? 200 : queueCapacity;
        fetchPoolSize = fetchPoolSize == null ? 8 : fetchPoolSize;
        schedulerPoolSize = schedulerPoolSize == null ? 2 : schedulerPoolSize;
    }
}
