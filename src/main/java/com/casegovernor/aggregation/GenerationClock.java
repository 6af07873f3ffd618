package com.casegovernor.aggregation;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues {@code generatedAt} stamps that strictly increase per case id, even when
 * the wall clock stalls or steps backwards.
 */
@Component
public class GenerationClock {

    private final Clock clock;
    private final ConcurrentHashMap<String, Instant> lastIssued = new ConcurrentHashMap<>();

    public GenerationClock(Clock clock) {
        this.clock = clock;
    }

    public Instant next(String caseId) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        return lastIssued.compute(caseId, (id, last) ->
            last == null || now.isAfter(last) ? now : last.plus(1, ChronoUnit.MICROS));
    }

    public Instant lastIssued(String caseId) {
        return lastIssued.get(caseId);
    }
}
