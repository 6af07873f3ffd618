package com.casegovernor.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parsed form of a rule condition: a tree of tagged predicate records.
 *
 * {@link #test} throws {@link UnresolvableFieldException} when an operand it needs
 * is missing or malformed; callers decide what that means for the rule.
 */
public sealed interface Condition
    permits Condition.Constant, Condition.Compare, Condition.In, Condition.Blank,
            Condition.And, Condition.Or, Condition.Not {

    boolean test(CaseFacts facts);

    Set<String> referencedFields();

    enum Operator {
        EQ("=="), NE("!="), GT(">"), GE(">="), LT("<"), LE("<=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    record Constant(boolean value) implements Condition {

        @Override
        public boolean test(CaseFacts facts) {
            return value;
        }

        @Override
        public Set<String> referencedFields() {
            return Set.of();
        }
    }

    record Compare(String field, Operator operator, Object literal) implements Condition {

        @Override
        public boolean test(CaseFacts facts) {
            Object actual = facts.value(field);
            return switch (operator) {
                case EQ -> Operands.equalTo(field, actual, literal);
                case NE -> literal == null ? actual != null : !Operands.equalTo(field, actual, literal);
                case GT -> Operands.compare(field, actual, literal) > 0;
                case GE -> Operands.compare(field, actual, literal) >= 0;
                case LT -> Operands.compare(field, actual, literal) < 0;
                case LE -> Operands.compare(field, actual, literal) <= 0;
            };
        }

        @Override
        public Set<String> referencedFields() {
            return Set.of(field);
        }
    }

    record In(String field, List<Object> literals) implements Condition {

        public In {
            // List.copyOf rejects nulls; literals may legitimately contain null
            literals = Collections.unmodifiableList(new ArrayList<>(literals));
        }

        @Override
        public boolean test(CaseFacts facts) {
            Object actual = facts.value(field);
            if (actual == null) {
                if (literals.contains(null)) {
                    return true;
                }
                throw new UnresolvableFieldException(field, "is missing");
            }
            for (Object literal : literals) {
                if (Operands.equalTo(field, actual, literal)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Set<String> referencedFields() {
            return Set.of(field);
        }
    }

    record Blank(String field, boolean negated) implements Condition {

        @Override
        public boolean test(CaseFacts facts) {
            return Operands.isBlank(facts.value(field)) != negated;
        }

        @Override
        public Set<String> referencedFields() {
            return Set.of(field);
        }
    }

    record And(Condition left, Condition right) implements Condition {

        @Override
        public boolean test(CaseFacts facts) {
            return left.test(facts) && right.test(facts);
        }

        @Override
        public Set<String> referencedFields() {
            Set<String> fields = new LinkedHashSet<>(left.referencedFields());
            fields.addAll(right.referencedFields());
            return fields;
        }
    }

    record Or(Condition left, Condition right) implements Condition {

        @Override
        public boolean test(CaseFacts facts) {
            return left.test(facts) || right.test(facts);
        }

        @Override
        public Set<String> referencedFields() {
            Set<String> fields = new LinkedHashSet<>(left.referencedFields());
            fields.addAll(right.referencedFields());
            return fields;
        }
    }

    record Not(Condition operand) implements Condition {

        @Override
        public boolean test(CaseFacts facts) {
            return !operand.test(facts);
        }

        @Override
        public Set<String> referencedFields() {
            return operand.referencedFields();
        }
    }
}
