package com.casegovernor.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * A refreshable slice of the case page. A scoped refresh re-reads the source
 * data of one section but always republishes a complete PageData.
 */
public enum Section {
    CASE("case"),
    CONTACT("contact"),
    ASSET("asset"),
    ACCOUNTS("accounts"),
    TASKS("tasks"),
    QUOTES("quotes"),
    WORK_ORDERS("work_orders"),
    RELATED_CASES("related_cases"),
    BUSINESS_RULES("business_rules");

    private final String value;

    Section(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup: accepts "work_orders", "workOrders", "WORK-ORDERS" and
     * the legacy "businessrules" alike.
     */
    @JsonCreator
    public static Section fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = normalize(raw);
        return Arrays.stream(values())
            .filter(v -> normalize(v.value).equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown section: " + raw));
    }

    private static String normalize(String raw) {
        return raw.replaceAll("[^A-Za-z0-9]", "").toLowerCase();
    }
}
