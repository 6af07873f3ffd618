package com.casegovernor.rules;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parsed SLA configuration.
 *
 * @param zone              zone in which case creation dates and the daily cutoff are read
 * @param cutoff            time of day at which a due date ends
 * @param atRiskLeadTime    how long before the due moment a case becomes at risk
 * @param offsets           business-day offsets keyed by lower-cased service type
 * @param defaultOffset     offset for service types without one, or {@code null} for none
 * @param calendar          weekend and holiday calendar
 * @param closedStatuses    lower-cased statuses that count as closed
 */
public record SlaPolicy(
    ZoneId zone,
    LocalTime cutoff,
    Duration atRiskLeadTime,
    Map<String, Integer> offsets,
    Integer defaultOffset,
    BusinessCalendar calendar,
    Set<String> closedStatuses
) {

    public static final LocalTime DEFAULT_CUTOFF = LocalTime.of(17, 0);
    public static final Duration DEFAULT_LEAD_TIME = Duration.ofHours(24);

    public SlaPolicy {
        offsets = Map.copyOf(offsets);
        closedStatuses = Set.copyOf(closedStatuses);
    }

    public static SlaPolicy from(SlaProperties properties) {
        try {
            ZoneId zone = properties.zone() == null ? ZoneId.of("UTC") : ZoneId.of(properties.zone());
            LocalTime cutoff = properties.cutoff() == null ? DEFAULT_CUTOFF : LocalTime.parse(properties.cutoff());
            Duration lead = properties.atRiskLeadTime() == null ? DEFAULT_LEAD_TIME : properties.atRiskLeadTime();
            Map<String, Integer> offsets = new HashMap<>();
            if (properties.businessDayOffsets() != null) {
                properties.businessDayOffsets().forEach((type, days) -> {
                    if (days == null || days < 0) {
                        throw new RuleConfigurationException("business day offset for " + type + " must be >= 0");
                    }
                    offsets.put(normalize(type), days);
                });
            }
            Set<LocalDate> holidays = properties.holidays() == null ? Set.of()
                : properties.holidays().stream().map(LocalDate::parse).collect(Collectors.toSet());
            Set<String> closed = properties.closedStatuses() == null ? Set.of()
                : properties.closedStatuses().stream().map(SlaPolicy::normalize).collect(Collectors.toSet());
            return new SlaPolicy(zone, cutoff, lead, offsets, properties.defaultOffset(),
                new BusinessCalendar(holidays), closed);
        } catch (DateTimeException ex) {
            throw new RuleConfigurationException("invalid governor.sla configuration: " + ex.getMessage(), ex);
        }
    }

    public static SlaPolicy of(Map<String, Integer> offsets, Integer defaultOffset, Set<LocalDate> holidays) {
        Map<String, Integer> normalized = new HashMap<>();
        offsets.forEach((type, days) -> normalized.put(normalize(type), days));
        return new SlaPolicy(ZoneId.of("UTC"), DEFAULT_CUTOFF, DEFAULT_LEAD_TIME, normalized, defaultOffset,
            new BusinessCalendar(holidays), Set.of("closed", "cancelled", "resolved"));
    }

    public Integer offsetFor(String serviceType) {
        if (serviceType == null) {
            return defaultOffset;
        }
        return offsets.getOrDefault(normalize(serviceType), defaultOffset);
    }

    public boolean isClosed(String status) {
        return status != null && closedStatuses.contains(normalize(status));
    }

    static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
