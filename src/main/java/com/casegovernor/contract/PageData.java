package com.casegovernor.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * The unit of distribution: everything a case page renders, built in one pass.
 *
 * {@code generatedAt} strictly increases per case id across successive builds;
 * consumers use it to discard out-of-order or duplicate deliveries.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PageData(
    String schemaVersion,
    String caseId,
    CaseSnapshot caseSnapshot,
    RelatedRecordSet relatedRecordSet,
    RuleResult ruleResult,
    AggregationOptions options,
    Instant generatedAt,
    String correlationId
) {

    public static final String SCHEMA_VERSION = "1.0.0";

    public boolean newerThan(PageData other) {
        return other == null || generatedAt.isAfter(other.generatedAt());
    }
}
