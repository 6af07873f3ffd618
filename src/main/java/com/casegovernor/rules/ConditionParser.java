package com.casegovernor.rules;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent parser for rule conditions.
 *
 * <pre>
 * expression := or
 * or         := and (('||' | 'or') and)*
 * and        := unary (('&amp;&amp;' | 'and') unary)*
 * unary      := ('!' | 'not') unary | primary
 * primary    := '(' expression ')' | 'true' | 'false' | predicate
 * predicate  := field ( op literal | 'in' '(' literal (',' literal)* ')' | 'is' ['not'] 'blank' )
 * op         := '==' | '=' | '!=' | '&gt;' | '&gt;=' | '&lt;' | '&lt;='
 * literal    := 'text' | "text" | number | true | false | null
 * </pre>
 *
 * Keywords are case-insensitive. Field names are checked against the vocabulary
 * the parser was created with.
 */
public class ConditionParser {

    private final Set<String> vocabulary;

    public ConditionParser(Set<String> vocabulary) {
        this.vocabulary = Set.copyOf(vocabulary);
    }

    public static ConditionParser forCaseFacts() {
        return new ConditionParser(CaseFacts.vocabulary());
    }

    public Condition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return new Condition.Constant(true);
        }
        Cursor cursor = new Cursor(expression, tokenize(expression));
        Condition condition = parseOr(cursor);
        if (!cursor.atEnd()) {
            throw cursor.error("unexpected '" + cursor.peek().text() + "'");
        }
        return condition;
    }

    private Condition parseOr(Cursor cursor) {
        Condition left = parseAnd(cursor);
        while (cursor.acceptSymbol("||") || cursor.acceptKeyword("or")) {
            left = new Condition.Or(left, parseAnd(cursor));
        }
        return left;
    }

    private Condition parseAnd(Cursor cursor) {
        Condition left = parseUnary(cursor);
        while (cursor.acceptSymbol("&&") || cursor.acceptKeyword("and")) {
            left = new Condition.And(left, parseUnary(cursor));
        }
        return left;
    }

    private Condition parseUnary(Cursor cursor) {
        if (cursor.acceptSymbol("!") || cursor.acceptKeyword("not")) {
            return new Condition.Not(parseUnary(cursor));
        }
        return parsePrimary(cursor);
    }

    private Condition parsePrimary(Cursor cursor) {
        if (cursor.acceptSymbol("(")) {
            Condition inner = parseOr(cursor);
            cursor.expectSymbol(")");
            return inner;
        }
        if (cursor.acceptKeyword("true")) {
            return new Condition.Constant(true);
        }
        if (cursor.acceptKeyword("false")) {
            return new Condition.Constant(false);
        }
        Token token = cursor.next();
        if (token.kind() != Kind.IDENTIFIER) {
            throw cursor.error("expected a field name but found '" + token.text() + "'");
        }
        String field = token.text();
        if (!vocabulary.contains(field)) {
            throw cursor.error("unknown field '" + field + "'");
        }
        return parsePredicate(cursor, field);
    }

    private Condition parsePredicate(Cursor cursor, String field) {
        if (cursor.acceptKeyword("is")) {
            boolean negated = cursor.acceptKeyword("not");
            if (!cursor.acceptKeyword("blank")) {
                throw cursor.error("expected 'blank' after 'is'");
            }
            return new Condition.Blank(field, negated);
        }
        if (cursor.acceptKeyword("in")) {
            cursor.expectSymbol("(");
            List<Object> literals = new ArrayList<>();
            do {
                literals.add(parseLiteral(cursor));
            } while (cursor.acceptSymbol(","));
            cursor.expectSymbol(")");
            return new Condition.In(field, literals);
        }
        Token op = cursor.next();
        Condition.Operator operator = switch (op.text()) {
            case "==", "=" -> Condition.Operator.EQ;
            case "!=", "<>" -> Condition.Operator.NE;
            case ">" -> Condition.Operator.GT;
            case ">=" -> Condition.Operator.GE;
            case "<" -> Condition.Operator.LT;
            case "<=" -> Condition.Operator.LE;
            default -> throw cursor.error("expected an operator after '" + field + "'");
        };
        if (op.kind() != Kind.SYMBOL) {
            throw cursor.error("expected an operator after '" + field + "'");
        }
        Object literal = parseLiteral(cursor);
        if (literal == null && operator != Condition.Operator.EQ && operator != Condition.Operator.NE) {
            throw cursor.error("null can only be compared with == or !=");
        }
        return new Condition.Compare(field, operator, literal);
    }

    private Object parseLiteral(Cursor cursor) {
        Token token = cursor.next();
        return switch (token.kind()) {
            case STRING -> token.text();
            case NUMBER -> new BigDecimal(token.text());
            case IDENTIFIER -> switch (token.text().toLowerCase(Locale.ROOT)) {
                case "true" -> Boolean.TRUE;
                case "false" -> Boolean.FALSE;
                case "null" -> null;
                default -> throw cursor.error("expected a literal but found '" + token.text() + "'");
            };
            default -> throw cursor.error("expected a literal but found '" + token.text() + "'");
        };
    }

    private List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '\'' || c == '"') {
                int end = expression.indexOf(c, i + 1);
                if (end < 0) {
                    throw new RuleConfigurationException(
                        "unterminated string at position " + i + " in: " + expression);
                }
                tokens.add(new Token(Kind.STRING, expression.substring(i + 1, end), i));
                i = end + 1;
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < expression.length()
                && Character.isDigit(expression.charAt(i + 1)))) {
                int start = i++;
                while (i < expression.length()
                    && (Character.isDigit(expression.charAt(i)) || expression.charAt(i) == '.')) {
                    i++;
                }
                String number = expression.substring(start, i);
                try {
                    new BigDecimal(number);
                } catch (NumberFormatException ex) {
                    throw new RuleConfigurationException(
                        "malformed number '" + number + "' at position " + start + " in: " + expression);
                }
                tokens.add(new Token(Kind.NUMBER, number, start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < expression.length()
                    && (Character.isLetterOrDigit(expression.charAt(i)) || expression.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(Kind.IDENTIFIER, expression.substring(start, i), start));
            } else {
                String two = i + 1 < expression.length() ? expression.substring(i, i + 2) : "";
                if (List.of("==", "!=", ">=", "<=", "&&", "||", "<>").contains(two)) {
                    tokens.add(new Token(Kind.SYMBOL, two, i));
                    i += 2;
                } else if ("=<>!(),".indexOf(c) >= 0) {
                    tokens.add(new Token(Kind.SYMBOL, String.valueOf(c), i));
                    i++;
                } else {
                    throw new RuleConfigurationException(
                        "unexpected character '" + c + "' at position " + i + " in: " + expression);
                }
            }
        }
        return tokens;
    }

    private enum Kind { IDENTIFIER, STRING, NUMBER, SYMBOL, END }

    private record Token(Kind kind, String text, int position) {
    }

    private static final class Cursor {

        private final String expression;
        private final List<Token> tokens;
        private int index;

        Cursor(String expression, List<Token> tokens) {
            this.expression = expression;
            this.tokens = tokens;
        }

        boolean atEnd() {
            return index >= tokens.size();
        }

        Token peek() {
            return atEnd() ? new Token(Kind.END, "<end>", expression.length()) : tokens.get(index);
        }

        Token next() {
            Token token = peek();
            if (!atEnd()) {
                index++;
            }
            return token;
        }

        boolean acceptSymbol(String symbol) {
            Token token = peek();
            if (token.kind() == Kind.SYMBOL && token.text().equals(symbol)) {
                index++;
                return true;
            }
            return false;
        }

        boolean acceptKeyword(String keyword) {
            Token token = peek();
            if (token.kind() == Kind.IDENTIFIER && token.text().equalsIgnoreCase(keyword)) {
                index++;
                return true;
            }
            return false;
        }

        void expectSymbol(String symbol) {
            if (!acceptSymbol(symbol)) {
                throw error("expected '" + symbol + "' but found '" + peek().text() + "'");
            }
        }

        RuleConfigurationException error(String message) {
            return new RuleConfigurationException(
                message + " at position " + peek().position() + " in: " + expression);
        }
    }
}
