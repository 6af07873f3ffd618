package com.casegovernor.context;

import com.casegovernor.contract.EntityType;

/**
 * Read permission was refused for a record. The message names the record only;
 * it never carries field values.
 */
public class RecordAccessDeniedException extends RuntimeException {

    private final EntityType type;
    private final String id;

    public RecordAccessDeniedException(EntityType type, String id) {
        super("read access denied for " + type + " record " + id);
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
