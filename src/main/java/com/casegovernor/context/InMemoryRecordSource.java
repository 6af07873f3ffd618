package com.casegovernor.context;

import com.casegovernor.contract.EntityRecord;
import com.casegovernor.contract.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class InMemoryRecordSource implements RecordSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRecordSource.class);

    private final ConcurrentHashMap<CacheKey, EntityRecord> records = new ConcurrentHashMap<>();
    private final Set<CacheKey> readDenied = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<CacheKey, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    private final AtomicInteger bulkFetches = new AtomicInteger();

    public void seed(EntityRecord record) {
        records.put(new CacheKey(record.type(), record.id()), record);
    }

    public void remove(EntityType type, String id) {
        records.remove(new CacheKey(type, id));
    }

    public void denyRead(EntityType type, String id) {
        readDenied.add(new CacheKey(type, id));
    }

    public void allowRead(EntityType type, String id) {
        readDenied.remove(new CacheKey(type, id));
    }

    public void clear() {
        records.clear();
        readDenied.clear();
        fetchCounts.clear();
        bulkFetches.set(0);
    }

    /** Number of times {@code id} was requested from this source. */
    public int fetchCount(EntityType type, String id) {
        AtomicInteger count = fetchCounts.get(new CacheKey(type, id));
        return count == null ? 0 : count.get();
    }

    public int bulkFetchCount() {
        return bulkFetches.get();
    }

    @Override
    public Optional<EntityRecord> fetch(EntityType type, String id) {
        RecordBatch batch = fetchMany(type, Set.of(id));
        if (batch.denied().contains(id)) {
            throw new RecordAccessDeniedException(type, id);
        }
        return Optional.ofNullable(batch.found().get(id));
    }

    @Override
    public RecordBatch fetchMany(EntityType type, Collection<String> ids) {
        bulkFetches.incrementAndGet();
        Map<String, EntityRecord> found = new LinkedHashMap<>();
        Set<String> denied = new LinkedHashSet<>();
        for (String id : ids) {
            CacheKey key = new CacheKey(type, id);
            fetchCounts.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
            if (readDenied.contains(key)) {
                denied.add(id);
                continue;
            }
            EntityRecord record = records.get(key);
            if (record != null) {
                found.put(id, record);
            }
        }
        return new RecordBatch(found, denied);
    }

    @Override
    public WriteResult write(RecordPatch patch) {
        if (patch.changes().isEmpty()) {
            return WriteResult.failed("patch has no changes");
        }
        if (patch.changes().keySet().stream().anyMatch(name -> name == null || name.isBlank())) {
            return WriteResult.failed("field names must not be blank");
        }
        EntityRecord updated = records.computeIfPresent(patch.key(), (k, current) -> current.withChanges(patch.changes()));
        if (updated == null) {
            return WriteResult.failed(patch.type() + " record not found: " + patch.id());
        }
        log.info("Wrote record key={} fields={}", patch.key(), patch.changes().keySet());
        return WriteResult.ok();
    }
}
