package com.casegovernor.context;

import com.casegovernor.contract.EntityType;
import com.casegovernor.support.Eventually;
import com.casegovernor.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static com.casegovernor.support.CaseRecords.record;
import static org.junit.jupiter.api.Assertions.*;

class ContextStoreSweeperTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T09:00:00Z"));
    private final InMemoryRecordSource source = new InMemoryRecordSource();
    private final ContextStoreProperties properties =
        new ContextStoreProperties(Duration.ofSeconds(30), Map.of(), Duration.ofMillis(20));
    private final ContextStore store = new ContextStore(source, properties, clock);
    private final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void sweep_removesExpiredEntriesWithoutARead() {
        source.seed(record(EntityType.CONTACT, "003A", "name", "Dana Reyes"));
        store.getById(EntityType.CONTACT, "003A");
        ContextStoreSweeper sweeper = new ContextStoreSweeper(store, properties, scheduler);

        clock.advance(Duration.ofSeconds(31));
        sweeper.sweep();

        assertEquals(0, store.cachedEntryCount());
    }

    @Test
    void start_schedulesTheSweepAtTheConfiguredInterval() {
        scheduler.initialize();
        source.seed(record(EntityType.CONTACT, "003A", "name", "Dana Reyes"));
        store.getById(EntityType.CONTACT, "003A");
        clock.advance(Duration.ofSeconds(31));

        ContextStoreSweeper sweeper = new ContextStoreSweeper(store, properties, scheduler);
        sweeper.start();
        try {
            Eventually.await("expired entry swept", () -> store.cachedEntryCount() == 0);
        } finally {
            sweeper.stop();
        }
    }
}
