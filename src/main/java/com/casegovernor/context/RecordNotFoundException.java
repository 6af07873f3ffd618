package com.casegovernor.context;

import com.casegovernor.contract.EntityType;

public class RecordNotFoundException extends RuntimeException {

    private final EntityType type;
    private final String id;

    public RecordNotFoundException(EntityType type, String id) {
        super(type + " record not found: " + id);
        this.type = type;
        this.id = id;
    }

    public EntityType getType() {
        return type;
    }

    public String getId() {
        return id;
    }
}
