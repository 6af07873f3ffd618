package com.casegovernor.consumer;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "governor.consumer")
public record ConsumerProperties(Duration governorWait) {

    public static final Duration DEFAULT_GOVERNOR_WAIT = Duration.ofSeconds(2);

    public ConsumerProperties {
        governorWait = governorWait == null ? DEFAULT_GOVERNOR_WAIT : governorWait;
        if (governorWait.isNegative()) {
            throw new IllegalArgumentException("governor.consumer.governor-wait must not be negative");
        }
    }
}
