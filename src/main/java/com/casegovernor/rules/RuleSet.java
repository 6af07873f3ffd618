package com.casegovernor.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated, ordered rules grouped by category.
 *
 * Compilation rejects the whole configuration on the first problem: duplicate or
 * blank ids, unparsable conditions, unknown field names, and rules missing what
 * their category needs. Inactive rules and rules for other object types are
 * validated too, then dropped.
 */
public final class RuleSet {

    private static final Logger log = LoggerFactory.getLogger(RuleSet.class);

    private static final Comparator<CompiledRule> EVALUATION_ORDER = Comparator
        .comparingInt((CompiledRule rule) -> rule.definition().order())
        .thenComparingInt(CompiledRule::declarationIndex);

    private final Map<RuleCategory, List<CompiledRule>> byCategory;

    private RuleSet(Map<RuleCategory, List<CompiledRule>> byCategory) {
        this.byCategory = byCategory;
    }

    public static RuleSet compile(List<RuleDefinition> definitions) {
        ConditionParser parser = ConditionParser.forCaseFacts();
        Set<String> seenIds = new HashSet<>();
        Map<RuleCategory, List<CompiledRule>> grouped = new EnumMap<>(RuleCategory.class);
        for (RuleCategory category : RuleCategory.values()) {
            grouped.put(category, new ArrayList<>());
        }

        int index = 0;
        for (RuleDefinition definition : definitions) {
            validate(definition, seenIds);
            Condition condition;
            try {
                condition = parser.parse(definition.condition());
            } catch (RuleConfigurationException ex) {
                throw new RuleConfigurationException(
                    "rule " + definition.id() + " has an invalid condition: " + ex.getMessage(), ex);
            }
            CompiledRule compiled = new CompiledRule(definition, condition, index++);
            if (definition.appliesToCase()) {
                grouped.get(definition.category()).add(compiled);
            }
        }

        grouped.values().forEach(rules -> rules.sort(EVALUATION_ORDER));
        Map<RuleCategory, List<CompiledRule>> frozen = new EnumMap<>(RuleCategory.class);
        grouped.forEach((category, rules) -> frozen.put(category, List.copyOf(rules)));
        log.info("Compiled rule set: {} definitions, active case rules per category={}",
            definitions.size(), counts(frozen));
        return new RuleSet(frozen);
    }

    public List<CompiledRule> rules(RuleCategory category) {
        return byCategory.get(category);
    }

    public int size() {
        return byCategory.values().stream().mapToInt(List::size).sum();
    }

    private static void validate(RuleDefinition definition, Set<String> seenIds) {
        if (definition.id() == null || definition.id().isBlank()) {
            throw new RuleConfigurationException("rule id is required");
        }
        if (!seenIds.add(definition.id())) {
            throw new RuleConfigurationException("duplicate rule id " + definition.id());
        }
        if (definition.category() == null) {
            throw new RuleConfigurationException("rule " + definition.id() + " has no category");
        }
        switch (definition.category()) {
            case FIELD_REQUIREMENT -> {
                if (definition.requiredFields().isEmpty()) {
                    throw new RuleConfigurationException(
                        "field requirement rule " + definition.id() + " names no required fields");
                }
                for (String field : definition.requiredFields()) {
                    if (!CaseFacts.isSnapshotField(field)) {
                        throw new RuleConfigurationException(
                            "field requirement rule " + definition.id() + " requires unknown case field " + field);
                    }
                }
            }
            case ACTION_VISIBILITY -> {
                if (definition.actionId() == null || definition.actionId().isBlank()) {
                    throw new RuleConfigurationException("visibility rule " + definition.id() + " has no action id");
                }
                if (definition.effect() == null) {
                    throw new RuleConfigurationException("visibility rule " + definition.id() + " has no effect");
                }
            }
            case APPROVAL_TRIGGER, CASE_MESSAGE -> {
                if (definition.condition() == null || definition.condition().isBlank()) {
                    throw new RuleConfigurationException(
                        definition.category() + " rule " + definition.id() + " needs a condition");
                }
            }
        }
    }

    private static Map<RuleCategory, Integer> counts(Map<RuleCategory, List<CompiledRule>> grouped) {
        Map<RuleCategory, Integer> counts = new EnumMap<>(RuleCategory.class);
        grouped.forEach((category, rules) -> counts.put(category, rules.size()));
        return counts;
    }
}
