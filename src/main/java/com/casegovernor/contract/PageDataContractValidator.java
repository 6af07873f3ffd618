package com.casegovernor.contract;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Schema checks for everything that crosses the broadcast channel.
 *
 * The hub validates before publishing and consumers validate after decoding,
 * so a half-populated PageData can never be mistaken for a complete one.
 */
@Component
public class PageDataContractValidator {

    private static final Pattern SEMVER = Pattern.compile("^[0-9]+\\.[0-9]+\\.[0-9]+$");

    public void validate(PageData pageData) {
        requireNonNull(pageData, "page_data cannot be null");
        requireString(pageData.schemaVersion(), "schema_version is required");
        if (!SEMVER.matcher(pageData.schemaVersion()).matches()) {
            throw new ContractViolationException("schema_version must be semver like 1.0.0");
        }
        if (!majorVersion(pageData.schemaVersion()).equals(majorVersion(PageData.SCHEMA_VERSION))) {
            throw new ContractViolationException(
                "unsupported schema_version " + pageData.schemaVersion() + ", expected " + PageData.SCHEMA_VERSION);
        }

        requireString(pageData.caseId(), "case_id is required");
        requireUuid(pageData.correlationId(), "correlation_id must be a valid UUID");
        requireNonNull(pageData.generatedAt(), "generated_at is required");
        requireNonNull(pageData.options(), "options is required");

        requireNonNull(pageData.caseSnapshot(), "case_snapshot is required");
        if (!pageData.caseId().equals(pageData.caseSnapshot().id())) {
            throw new ContractViolationException("case_snapshot.id does not match case_id");
        }

        validateRelated(pageData.relatedRecordSet());
        validateRuleResult(pageData.ruleResult(), pageData.options());
    }

    public void validate(ChannelMessage message) {
        requireNonNull(message, "message cannot be null");
        requireString(message.caseId(), "case_id is required");
        requireNonNull(message.eventType(), "event_type is required");
        requireNonNull(message.timestamp(), "timestamp is required");

        switch (message.eventType()) {
            case LOAD -> requireString(message.pageData(), "page_data is required for load events");
            case REFRESH -> {
                if (message.section() != null && !message.section().isBlank()) {
                    try {
                        Section.fromValue(message.section());
                    } catch (IllegalArgumentException ex) {
                        throw new ContractViolationException("section is invalid: " + message.section());
                    }
                }
            }
            case ERROR -> {
                requireString(message.errorMessage(), "error_message is required for error events");
                if (message.hasPageData()) {
                    throw new ContractViolationException("error events must not carry page_data");
                }
            }
        }
    }

    private void validateRelated(RelatedRecordSet related) {
        requireNonNull(related, "related_record_set is required");
        checkKeys(related.accounts(), EntityType.ACCOUNT, "related_record_set.accounts");
        checkKeys(related.contacts(), EntityType.CONTACT, "related_record_set.contacts");
        checkKeys(related.assets(), EntityType.ASSET, "related_record_set.assets");
        checkKeys(related.openTasks(), EntityType.TASK, "related_record_set.open_tasks");
        checkKeys(related.relatedCases(), EntityType.CASE, "related_record_set.related_cases");
        checkKeys(related.quotes(), EntityType.QUOTE, "related_record_set.quotes");
        checkKeys(related.workOrders(), EntityType.WORK_ORDER, "related_record_set.work_orders");
    }

    private void checkKeys(Map<String, EntityRecord> records, EntityType expectedType, String path) {
        requireNonNull(records, path + " is required");
        records.forEach((id, record) -> {
            requireNonNull(record, path + " contains a null record");
            if (!id.equals(record.id())) {
                throw new ContractViolationException(path + " key " + id + " does not match record id");
            }
            if (record.type() != expectedType) {
                throw new ContractViolationException(path + " contains a " + record.type() + " record");
            }
        });
    }

    private void validateRuleResult(RuleResult result, AggregationOptions options) {
        requireNonNull(result, "rule_result is required");
        requireNonNull(result.sla(), "rule_result.sla is required");
        requireNonNull(result.approval(), "rule_result.approval is required");
        if (options.evaluateRules() && !result.evaluated()) {
            throw new ContractViolationException("rule_result must be evaluated when options.evaluate_rules=true");
        }
        if (result.approval().required() && result.approval().triggeringRule() == null) {
            throw new ContractViolationException("rule_result.approval.triggering_rule is required when approval is required");
        }
        if (!result.approval().required() && result.approval().status() != ApprovalStatus.NONE) {
            throw new ContractViolationException("rule_result.approval.status must be none when approval is not required");
        }
    }

    private String majorVersion(String version) {
        return version.substring(0, version.indexOf('.'));
    }

    private String requireString(Object value, String message) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ContractViolationException(message);
        }
        return text;
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ContractViolationException(message);
        }
    }

    private void requireUuid(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ContractViolationException(message);
        }
        try {
            UUID.fromString(value);
        } catch (IllegalArgumentException ex) {
            throw new ContractViolationException(message);
        }
    }
}
