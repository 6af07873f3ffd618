package com.casegovernor.context;

import com.casegovernor.contract.EntityRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a bulk read. Ids the caller may not read are reported in
 * {@code denied}; ids with no record appear in neither collection.
 */
public record RecordBatch(Map<String, EntityRecord> found, Set<String> denied) {

    public RecordBatch {
        found = found == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(found));
        denied = denied == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(denied));
    }

    public static RecordBatch of(Map<String, EntityRecord> found) {
        return new RecordBatch(found, Set.of());
    }

    public boolean isPartial() {
        return !denied.isEmpty();
    }
}
