package com.casegovernor.rules;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Raw SLA settings. Times and dates stay strings here and are parsed once into an
 * {@link SlaPolicy}, so a malformed value fails startup with a readable message.
 */
@ConfigurationProperties(prefix = "governor.sla")
public record SlaProperties(
    String zone,
    String cutoff,
    Duration atRiskLeadTime,
    Map<String, Integer> businessDayOffsets,
    Integer defaultOffset,
    List<String> holidays,
    List<String> closedStatuses
) {
}
