package com.casegovernor.context;

import com.casegovernor.contract.EntityType;

import java.util.Objects;

public record CacheKey(EntityType type, String id) {

    public CacheKey {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
