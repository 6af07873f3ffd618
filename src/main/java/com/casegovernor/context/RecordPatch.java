package com.casegovernor.context;

import com.casegovernor.contract.EntityType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Field changes for one record, handed to the persistence boundary by a consumer. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RecordPatch(EntityType type, String id, Map<String, Object> changes) {

    public RecordPatch {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        changes = changes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(changes));
    }

    public CacheKey key() {
        return new CacheKey(type, id);
    }
}
