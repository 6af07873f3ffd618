package com.casegovernor.rules;

/**
 * A condition operand is missing or has a shape the operator cannot work with.
 * The evaluator treats the rule as non-matching and moves on.
 */
public class UnresolvableFieldException extends RuntimeException {

    private final String field;

    public UnresolvableFieldException(String field, String reason) {
        super(field + " " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
