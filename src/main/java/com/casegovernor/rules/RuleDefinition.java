package com.casegovernor.rules;

import com.casegovernor.contract.RuleSeverity;

import java.util.List;

/**
 * One externally supplied declarative rule, as bound from {@code governor.rules.definitions}.
 *
 * @param id             stable rule id, reported as the approval triggering rule
 * @param targetObject   object type the rule applies to; only {@code Case} rules are evaluated
 * @param category       which evaluator function interprets the rule
 * @param condition      condition expression, see {@link ConditionParser}
 * @param message        user-facing text carried into rule messages
 * @param severity       severity of that message
 * @param active         inactive rules are ignored
 * @param order          evaluation priority, lower first; ties keep declaration order
 * @param requiredFields fields a matching FIELD_REQUIREMENT rule marks required
 * @param actionId       action a ACTION_VISIBILITY rule shows or hides
 * @param effect         SHOW or HIDE
 */
public record RuleDefinition(
    String id,
    String targetObject,
    RuleCategory category,
    String condition,
    String message,
    RuleSeverity severity,
    Boolean active,
    Integer order,
    List<String> requiredFields,
    String actionId,
    ActionEffect effect
) {

    public static final String CASE_OBJECT = "Case";

    public RuleDefinition {
        targetObject = targetObject == null || targetObject.isBlank() ? CASE_OBJECT : targetObject;
        severity = severity == null ? RuleSeverity.ERROR : severity;
        active = active == null ? Boolean.TRUE : active;
        order = order == null ? 0 : order;
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    }

    public boolean appliesToCase() {
        return active && CASE_OBJECT.equalsIgnoreCase(targetObject);
    }

    public static RuleDefinition fieldRequirement(String id, int order, String condition,
                                                  List<String> requiredFields, String message) {
        return new RuleDefinition(id, CASE_OBJECT, RuleCategory.FIELD_REQUIREMENT, condition, message,
            RuleSeverity.ERROR, true, order, requiredFields, null, null);
    }

    public static RuleDefinition actionVisibility(String id, int order, String condition,
                                                  String actionId, ActionEffect effect) {
        return new RuleDefinition(id, CASE_OBJECT, RuleCategory.ACTION_VISIBILITY, condition, null,
            RuleSeverity.INFO, true, order, null, actionId, effect);
    }

    public static RuleDefinition approvalTrigger(String id, int order, String condition, String message) {
        return new RuleDefinition(id, CASE_OBJECT, RuleCategory.APPROVAL_TRIGGER, condition, message,
            RuleSeverity.WARNING, true, order, null, null, null);
    }

    public static RuleDefinition caseMessage(String id, int order, String condition,
                                             RuleSeverity severity, String message) {
        return new RuleDefinition(id, CASE_OBJECT, RuleCategory.CASE_MESSAGE, condition, message,
            severity, true, order, null, null, null);
    }
}
