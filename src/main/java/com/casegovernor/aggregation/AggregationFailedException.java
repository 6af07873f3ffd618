package com.casegovernor.aggregation;

/**
 * The case record itself could not be loaded, so no PageData exists for this build.
 * Builds for other cases are unaffected.
 */
public class AggregationFailedException extends RuntimeException {

    private final String caseId;

    public AggregationFailedException(String caseId, Throwable cause) {
        super("page data aggregation failed for case " + caseId + ": " + cause.getMessage(), cause);
        this.caseId = caseId;
    }

    public String getCaseId() {
        return caseId;
    }
}
