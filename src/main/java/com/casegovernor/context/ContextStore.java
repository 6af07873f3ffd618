package com.casegovernor.context;

import com.casegovernor.contract.EntityRecord;
import com.casegovernor.contract.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Cached read path over the {@link RecordSource}. The only owner of cache entries.
 *
 * <ul>
 *   <li>Reads never return an entry whose TTL has elapsed.</li>
 *   <li>Concurrent misses for the same key share one in-flight fetch.</li>
 *   <li>{@link #invalidate} bumps the key's generation: a fetch started before the
 *       invalidation completes for its own callers but does not populate the cache,
 *       and callers arriving afterwards start a fresh fetch. Generations are kept
 *       only while a fetch for the key is outstanding.</li>
 *   <li>Denied reads are reported per id and are never cached.</li>
 * </ul>
 */
@Service
public class ContextStore {

    private static final Logger log = LoggerFactory.getLogger(ContextStore.class);

    private final RecordSource recordSource;
    private final ContextStoreProperties properties;
    private final Clock clock;

    private final ConcurrentHashMap<CacheKey, CacheEntry> cache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<CacheKey, CompletableFuture<Optional<EntityRecord>>> inFlight =
        new ConcurrentHashMap<>();
    private final ConcurrentHashMap<CacheKey, ClaimState> claims = new ConcurrentHashMap<>();

    public ContextStore(RecordSource recordSource, ContextStoreProperties properties, Clock clock) {
        this.recordSource = recordSource;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws RecordNotFoundException     if the backing store has no such record
     * @throws RecordAccessDeniedException if the caller may not read it
     */
    public EntityRecord getById(EntityType type, String id) {
        RecordBatch batch = readMany(type, List.of(id));
        if (batch.denied().contains(id)) {
            throw new RecordAccessDeniedException(type, id);
        }
        EntityRecord record = batch.found().get(id);
        if (record == null) {
            throw new RecordNotFoundException(type, id);
        }
        return record;
    }

    /**
     * Readable records among {@code ids}. Ids without a record, and ids the caller
     * may not read, are absent from the result.
     */
    public Map<String, EntityRecord> getManyByIds(EntityType type, Collection<String> ids) {
        return readMany(type, ids).found();
    }

    /**
     * Resolves every id, issuing at most one bulk fetch for the ids that are neither
     * cached nor already being fetched. Denied ids are reported per id and never cached.
     */
    public RecordBatch readMany(EntityType type, Collection<String> ids) {
        Instant now = clock.instant();
        Map<String, Optional<EntityRecord>> resolved = new LinkedHashMap<>();
        Set<String> denied = new LinkedHashSet<>();
        Map<String, CompletableFuture<Optional<EntityRecord>>> joined = new LinkedHashMap<>();
        Map<String, Claim> claimed = new LinkedHashMap<>();

        for (String id : new LinkedHashSet<>(ids)) {
            if (id == null || id.isBlank()) {
                continue;
            }
            CacheKey key = new CacheKey(type, id);
            CacheEntry entry = cache.get(key);
            if (entry != null && !entry.isExpiredAt(now)) {
                resolved.put(id, entry.value());
                continue;
            }
            if (entry != null) {
                cache.remove(key, entry);
            }
            CompletableFuture<Optional<EntityRecord>> mine = new CompletableFuture<>();
            CompletableFuture<Optional<EntityRecord>> existing = inFlight.putIfAbsent(key, mine);
            if (existing != null) {
                joined.put(id, existing);
            } else {
                claimed.put(id, new Claim(key, mine, register(key)));
            }
        }

        if (!claimed.isEmpty()) {
            fetchClaimed(type, claimed, resolved, denied);
        }
        joined.forEach((id, future) -> {
            try {
                resolved.put(id, await(future));
            } catch (RecordAccessDeniedException ex) {
                denied.add(id);
            }
        });

        Map<String, EntityRecord> found = new LinkedHashMap<>();
        for (String id : ids) {
            Optional<EntityRecord> value = resolved.get(id);
            if (value != null && value.isPresent()) {
                found.put(id, value.get());
            }
        }
        return new RecordBatch(found, denied);
    }

    /** Drops the cached entry and detaches any in-flight fetch for it. Idempotent. */
    public void invalidate(EntityType type, String id) {
        if (id == null) {
            return;
        }
        CacheKey key = new CacheKey(type, id);
        claims.computeIfPresent(key, (k, state) -> state.invalidated());
        cache.remove(key);
        inFlight.remove(key);
        log.debug("Invalidated cache entry key={}", key);
    }

    public void invalidateAll(EntityType type, Collection<String> ids) {
        ids.forEach(id -> invalidate(type, id));
    }

    /** Removes entries whose TTL has elapsed. Returns the number removed. */
    public int evictExpired() {
        Instant now = clock.instant();
        int evicted = 0;
        for (CacheEntry entry : cache.values()) {
            if (entry.isExpiredAt(now) && cache.remove(entry.key(), entry)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted expired cache entries count={}", evicted);
        }
        return evicted;
    }

    public int cachedEntryCount() {
        return cache.size();
    }

    /** Keys with a fetch still outstanding, including fetches detached by an invalidation. */
    int trackedKeyCount() {
        return claims.size();
    }

    private void fetchClaimed(EntityType type, Map<String, Claim> claimed,
                              Map<String, Optional<EntityRecord>> resolved, Set<String> denied) {
        RecordBatch batch;
        try {
            batch = recordSource.fetchMany(type, new ArrayList<>(claimed.keySet()));
        } catch (RuntimeException ex) {
            claimed.values().forEach(claim -> {
                inFlight.remove(claim.key(), claim.future());
                release(claim.key());
                claim.future().completeExceptionally(ex);
            });
            throw ex;
        }
        log.debug("Fetched type={} requested={} found={} denied={}",
            type, claimed.size(), batch.found().size(), batch.denied().size());

        Instant fetchedAt = clock.instant();
        claimed.forEach((id, claim) -> {
            inFlight.remove(claim.key(), claim.future());
            if (batch.denied().contains(id)) {
                release(claim.key());
                denied.add(id);
                claim.future().completeExceptionally(new RecordAccessDeniedException(type, id));
                return;
            }
            Optional<EntityRecord> value = Optional.ofNullable(batch.found().get(id));
            CacheEntry entry = new CacheEntry(claim.key(), value, fetchedAt, properties.ttlFor(type));
            cache.compute(claim.key(), (k, current) ->
                generationOf(k) == claim.generation() ? entry : current);
            release(claim.key());
            claim.future().complete(value);
            resolved.put(id, value);
        });
    }

    /** Counts a new outstanding fetch for {@code key} and returns the generation it started in. */
    private long register(CacheKey key) {
        return claims.compute(key, (k, state) -> state == null ? new ClaimState(0L, 1) : state.claimed())
            .generation();
    }

    /** The key stops being tracked once its last outstanding fetch has finished. */
    private void release(CacheKey key) {
        claims.computeIfPresent(key, (k, state) -> state.pending() <= 1 ? null : state.released());
    }

    private long generationOf(CacheKey key) {
        ClaimState state = claims.get(key);
        return state == null ? 0L : state.generation();
    }

    private Optional<EntityRecord> await(CompletableFuture<Optional<EntityRecord>> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for an in-flight fetch", ex);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new CompletionException(ex.getCause());
        }
    }

    private record Claim(CacheKey key, CompletableFuture<Optional<EntityRecord>> future, long generation) {
    }

    /** Invalidation generation of a key and the number of fetches for it still outstanding. */
    private record ClaimState(long generation, int pending) {

        ClaimState claimed() {
            return new ClaimState(generation, pending + 1);
        }

        ClaimState released() {
            return new ClaimState(generation, pending - 1);
        }

        ClaimState invalidated() {
            return new ClaimState(generation + 1, pending);
        }
    }
}
