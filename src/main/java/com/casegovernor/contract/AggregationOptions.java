package com.casegovernor.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AggregationOptions(boolean includeRelated, boolean evaluateRules) {

    public static AggregationOptions full() {
        return new AggregationOptions(true, true);
    }

    public static AggregationOptions caseOnly() {
        return new AggregationOptions(false, false);
    }
}
