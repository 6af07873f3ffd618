package com.casegovernor.consumer;

import com.casegovernor.contract.PageData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the newest PageData of one case. Deliveries that are not strictly newer
 * than the applied one, by {@code generatedAt}, are discarded.
 */
public class PageDataReducer {

    private static final Logger log = LoggerFactory.getLogger(PageDataReducer.class);

    private final String caseId;
    private final AtomicReference<PageData> current = new AtomicReference<>();

    public PageDataReducer(String caseId) {
        this.caseId = caseId;
    }

    /** Returns true when {@code candidate} became the current state. */
    public boolean apply(PageData candidate) {
        if (!caseId.equals(candidate.caseId())) {
            log.debug("Ignoring page data for case={} in reducer of case={}", candidate.caseId(), caseId);
            return false;
        }
        while (true) {
            PageData applied = current.get();
            if (!candidate.newerThan(applied)) {
                log.debug("Stale data discarded case={} generated_at={} applied_generated_at={}",
                    caseId, candidate.generatedAt(), applied.generatedAt());
                return false;
            }
            if (current.compareAndSet(applied, candidate)) {
                return true;
            }
        }
    }

    public Optional<PageData> current() {
        return Optional.ofNullable(current.get());
    }
}
