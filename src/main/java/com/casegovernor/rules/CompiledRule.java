package com.casegovernor.rules;

/** A rule definition with its condition parsed, plus its position in the configuration. */
public record CompiledRule(RuleDefinition definition, Condition condition, int declarationIndex) {

    public String id() {
        return definition.id();
    }

    public RuleCategory category() {
        return definition.category();
    }
}
