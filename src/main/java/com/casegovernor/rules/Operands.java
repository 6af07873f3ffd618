package com.casegovernor.rules;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collection;

/** Operand coercion shared by the condition records. */
final class Operands {

    private Operands() {
    }

    static boolean equalTo(String field, Object actual, Object literal) {
        if (literal == null) {
            return actual == null;
        }
        if (actual == null) {
            throw new UnresolvableFieldException(field, "is missing");
        }
        if (literal instanceof BigDecimal number) {
            return decimal(field, actual).compareTo(number) == 0;
        }
        if (literal instanceof Boolean flag) {
            return bool(field, actual) == flag;
        }
        return text(actual).equals(literal);
    }

    static int compare(String field, Object actual, Object literal) {
        if (actual == null) {
            throw new UnresolvableFieldException(field, "is missing");
        }
        if (literal instanceof BigDecimal number) {
            return decimal(field, actual).compareTo(number);
        }
        if (literal instanceof String text) {
            try {
                if (actual instanceof LocalDate date) {
                    return date.compareTo(LocalDate.parse(text));
                }
                if (actual instanceof Instant instant) {
                    return instant.compareTo(Instant.parse(text));
                }
            } catch (DateTimeParseException ex) {
                throw new UnresolvableFieldException(field, "cannot be compared with '" + text + "'");
            }
            if (actual instanceof String actualText) {
                return actualText.compareTo(text);
            }
        }
        throw new UnresolvableFieldException(field, "is not ordered against " + literal);
    }

    static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.toString().isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        return false;
    }

    private static BigDecimal decimal(String field, Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException ex) {
                throw new UnresolvableFieldException(field, "is not numeric");
            }
        }
        throw new UnresolvableFieldException(field, "is not numeric");
    }

    private static boolean bool(String field, Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return false;
            }
        }
        throw new UnresolvableFieldException(field, "is not a boolean");
    }

    private static String text(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return String.valueOf(value);
    }
}
