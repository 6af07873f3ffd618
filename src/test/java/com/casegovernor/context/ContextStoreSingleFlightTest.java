package com.casegovernor.context;

import com.casegovernor.contract.EntityRecord;
import com.casegovernor.contract.EntityType;
import com.casegovernor.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.casegovernor.support.CaseRecords.record;
import static org.junit.jupiter.api.Assertions.*;

class ContextStoreSingleFlightTest {

    private static final String WORKER_PREFIX = "single-flight-worker-";

    private InMemoryRecordSource delegate;
    private GatedRecordSource source;
    private ContextStore store;
    private ExecutorService pool;
    private int workerIds;

    @BeforeEach
    void setUp() {
        delegate = new InMemoryRecordSource();
        source = new GatedRecordSource(delegate);
        store = new ContextStore(source, ContextStoreProperties.defaults(),
            new MutableClock(Instant.parse("2026-10-19T09:00:00Z")));
        pool = Executors.newFixedThreadPool(8, runnable -> new Thread(runnable, WORKER_PREFIX + workerIds++));
        for (String id : List.of("A1", "A2", "A3", "A4")) {
            delegate.seed(record(EntityType.ASSET, id, "serial", "SN-" + id));
        }
    }

    @AfterEach
    void tearDown() {
        source.open();
        pool.shutdownNow();
    }

    @Test
    @DisplayName("Concurrent overlapping requests fetch each unique id exactly once")
    void overlappingConcurrentRequests_fetchEachIdOnce() throws Exception {
        source.close();
        List<List<String>> requests = List.of(
            List.of("A1", "A2"),
            List.of("A2", "A3"),
            List.of("A1", "A3", "A4"),
            List.of("A4"),
            List.of("A1", "A2", "A3", "A4"),
            List.of("A2"),
            List.of("A3", "A1"),
            List.of("A4", "A2"));

        List<Future<Map<String, EntityRecord>>> results = new ArrayList<>();
        for (List<String> ids : requests) {
            results.add(pool.submit(() -> store.getManyByIds(EntityType.ASSET, ids)));
        }
        awaitParked(requests.size());
        source.open();

        for (int i = 0; i < requests.size(); i++) {
            Map<String, EntityRecord> found = results.get(i).get(5, TimeUnit.SECONDS);
            assertEquals(requests.get(i).size(), found.size());
            assertTrue(found.keySet().containsAll(requests.get(i)));
        }
        for (String id : List.of("A1", "A2", "A3", "A4")) {
            assertEquals(1, delegate.fetchCount(EntityType.ASSET, id), "fetches of " + id);
        }
    }

    @Test
    @DisplayName("Invalidate during an in-flight fetch keeps the stale result out of the cache")
    void invalidateDuringFetch_doesNotCacheStaleResult() throws Exception {
        source.close();
        Future<EntityRecord> stale = pool.submit(() -> store.getById(EntityType.ASSET, "A1"));
        assertTrue(source.awaitEntered(5, TimeUnit.SECONDS));

        source.passThrough();
        delegate.seed(record(EntityType.ASSET, "A1", "serial", "SN-A1-REPLACED"));
        store.invalidate(EntityType.ASSET, "A1");

        EntityRecord fresh = store.getById(EntityType.ASSET, "A1");
        assertEquals("SN-A1-REPLACED", fresh.stringField("serial"));

        source.open();
        assertEquals("SN-A1", stale.get(5, TimeUnit.SECONDS).stringField("serial"));

        assertEquals("SN-A1-REPLACED", store.getById(EntityType.ASSET, "A1").stringField("serial"));
        assertEquals(2, delegate.fetchCount(EntityType.ASSET, "A1"));
        assertEquals(0, store.trackedKeyCount());
    }

    @Test
    @DisplayName("A denied read is reported to every caller that joined it")
    void failedFetch_propagatesToJoinedCallers() throws Exception {
        delegate.denyRead(EntityType.ASSET, "A1");
        source.close();

        Future<EntityRecord> first = pool.submit(() -> store.getById(EntityType.ASSET, "A1"));
        Future<EntityRecord> second = pool.submit(() -> store.getById(EntityType.ASSET, "A1"));
        awaitParked(2);
        source.open();

        for (Future<EntityRecord> future : List.of(first, second)) {
            Exception ex = assertThrows(Exception.class, () -> future.get(5, TimeUnit.SECONDS));
            assertInstanceOf(RecordAccessDeniedException.class, ex.getCause());
        }
        assertEquals(1, delegate.fetchCount(EntityType.ASSET, "A1"));
    }

    /** Waits until {@code workers} pool threads are blocked, inside a fetch or joined to one. */
    private void awaitParked(int workers) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (source.entered() > 0 && parkedWorkers() == workers) {
                return;
            }
            Thread.sleep(10);
        }
        fail("workers did not park in time");
    }

    private long parkedWorkers() {
        return Thread.getAllStackTraces().keySet().stream()
            .filter(t -> t.getName().startsWith(WORKER_PREFIX))
            .filter(t -> t.getState() == Thread.State.WAITING || t.getState() == Thread.State.TIMED_WAITING)
            .count();
    }

    /** Reads immediately, then holds the result at a gate so concurrent callers overlap deterministically. */
    static final class GatedRecordSource implements RecordSource {

        private final RecordSource delegate;
        private final CountDownLatch firstEntered = new CountDownLatch(1);
        private volatile CountDownLatch closed = new CountDownLatch(0);
        private volatile CountDownLatch gate = closed;
        private volatile int entered;

        GatedRecordSource(RecordSource delegate) {
            this.delegate = delegate;
        }

        void close() {
            closed = new CountDownLatch(1);
            gate = closed;
        }

        void open() {
            closed.countDown();
            gate = closed;
        }

        /** Later fetches skip the gate; fetches already waiting stay held until {@link #open()}. */
        void passThrough() {
            gate = new CountDownLatch(0);
        }

        int entered() {
            return entered;
        }

        boolean awaitEntered(long timeout, TimeUnit unit) throws InterruptedException {
            return firstEntered.await(timeout, unit);
        }

        @Override
        public Optional<EntityRecord> fetch(EntityType type, String id) {
            return delegate.fetch(type, id);
        }

        @Override
        public RecordBatch fetchMany(EntityType type, Collection<String> ids) {
            CountDownLatch held = gate;
            synchronized (this) {
                entered++;
            }
            RecordBatch batch = delegate.fetchMany(type, ids);
            firstEntered.countDown();
            try {
                held.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(ex);
            }
            return batch;
        }

        @Override
        public WriteResult write(RecordPatch patch) {
            return delegate.write(patch);
        }
    }
}
