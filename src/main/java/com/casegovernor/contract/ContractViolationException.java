package com.casegovernor.contract;

/**
 * Raised when a PageData or channel message does not satisfy the published schema.
 */
public class ContractViolationException extends RuntimeException {

    public ContractViolationException(String message) {
        super(message);
    }

    public ContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
