package com.casegovernor.context;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WriteResult(boolean success, List<String> errors) {

    public WriteResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static WriteResult ok() {
        return new WriteResult(true, List.of());
    }

    public static WriteResult failed(String... errors) {
        return new WriteResult(false, List.of(errors));
    }
}
