package com.casegovernor.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Combined output of the four rule categories for one case.
 *
 * Maps and sets are sorted so that two evaluations over equal inputs are
 * equal and serialize identically.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RuleResult(
    boolean evaluated,
    Map<String, Boolean> requiredFields,
    Set<String> visibleActions,
    SlaAssessment sla,
    ApprovalOutcome approval,
    List<RuleMessage> messages
) {

    public RuleResult {
        requiredFields = requiredFields == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(requiredFields));
        visibleActions = visibleActions == null
            ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(visibleActions));
        sla = Objects.requireNonNullElse(sla, SlaAssessment.unscheduled());
        approval = Objects.requireNonNullElse(approval, ApprovalOutcome.none());
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    /** Placeholder carried by a PageData built with {@code evaluateRules=false}. */
    public static RuleResult notEvaluated() {
        return new RuleResult(false, null, null, null, null, null);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SlaAssessment(LocalDate dueDate, SlaStatus status) {

        public SlaAssessment {
            Objects.requireNonNull(status, "status");
        }

        public static SlaAssessment unscheduled() {
            return new SlaAssessment(null, SlaStatus.ON_TRACK);
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ApprovalOutcome(boolean required, ApprovalStatus status, String triggeringRule) {

        public ApprovalOutcome {
            Objects.requireNonNull(status, "status");
        }

        public static ApprovalOutcome none() {
            return new ApprovalOutcome(false, ApprovalStatus.NONE, null);
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RuleMessage(String ruleId, RuleSeverity severity, String message, List<String> fields) {

        public RuleMessage {
            fields = fields == null ? List.of() : List.copyOf(fields);
        }
    }
}
