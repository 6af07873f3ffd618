package com.casegovernor.context;

import com.casegovernor.contract.EntityRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * One cached read. Entries are never mutated; a newer read replaces the entry
 * wholesale. {@code value} is empty when the backing store reported no record.
 */
public record CacheEntry(CacheKey key, Optional<EntityRecord> value, Instant fetchedAt, Duration ttl) {

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(fetchedAt.plus(ttl));
    }
}
