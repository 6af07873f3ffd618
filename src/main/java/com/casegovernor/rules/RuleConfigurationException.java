package com.casegovernor.rules;

/**
 * Rule configuration cannot be interpreted: an unparsable condition, an unknown
 * field name, or a rule missing what its category needs. Raised while the rule
 * set is compiled, never during evaluation.
 */
public class RuleConfigurationException extends RuntimeException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
