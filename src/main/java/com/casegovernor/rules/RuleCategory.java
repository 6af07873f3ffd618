package com.casegovernor.rules;

public enum RuleCategory {
    FIELD_REQUIREMENT,
    ACTION_VISIBILITY,
    APPROVAL_TRIGGER,
    CASE_MESSAGE
}
