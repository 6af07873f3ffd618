package com.casegovernor.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, read-only snapshot of one backing record. Instances are shared
 * between the cache and every PageData that references them.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EntityRecord(
    EntityType type,
    String id,
    Map<String, Object> fields
) {

    public EntityRecord {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        // LinkedHashMap copy: record fields may legitimately hold nulls
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object field(String name) {
        return fields.get(name);
    }

    public String stringField(String name) {
        Object value = fields.get(name);
        return value == null ? null : String.valueOf(value);
    }

    /** Returns a new record with {@code changes} applied on top of the current fields. */
    public EntityRecord withChanges(Map<String, Object> changes) {
        Map<String, Object> merged = new LinkedHashMap<>(fields);
        merged.putAll(changes);
        return new EntityRecord(type, id, merged);
    }
}
