package com.casegovernor.context;

import com.casegovernor.contract.EntityRecord;
import com.casegovernor.contract.EntityType;

import java.util.Collection;
import java.util.Optional;

/**
 * Persistence boundary. The core only reads through it; writes are issued by
 * consumers, followed by an invalidation and a refresh request.
 *
 * {@link #fetch} throws {@link RecordAccessDeniedException} when the caller may
 * not read the record; {@link #fetchMany} reports such ids in the batch instead.
 */
public interface RecordSource {

    Optional<EntityRecord> fetch(EntityType type, String id);

    /** Ids without a record are absent from both {@code found} and {@code denied}. */
    RecordBatch fetchMany(EntityType type, Collection<String> ids);

    WriteResult write(RecordPatch patch);
}
