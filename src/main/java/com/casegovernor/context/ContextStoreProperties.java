package com.casegovernor.context;

import com.casegovernor.contract.EntityType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@ConfigurationProperties(prefix = "governor.cache")
public record ContextStoreProperties(Duration defaultTtl, Map<EntityType, Duration> ttl, Duration sweepInterval) {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);

    public ContextStoreProperties {
        if (defaultTtl == null) {
            defaultTtl = DEFAULT_TTL;
        }
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("governor.cache.default-ttl must be positive");
        }
        if (sweepInterval == null) {
            sweepInterval = DEFAULT_SWEEP_INTERVAL;
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("governor.cache.sweep-interval must be positive");
        }
        ttl = ttl == null || ttl.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(ttl));
    }

    public static ContextStoreProperties defaults() {
        return new ContextStoreProperties(DEFAULT_TTL, Map.of(), DEFAULT_SWEEP_INTERVAL);
    }

    public Duration ttlFor(EntityType type) {
        return ttl.getOrDefault(type, defaultTtl);
    }
}
