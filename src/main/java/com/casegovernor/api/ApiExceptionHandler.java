package com.casegovernor.api;

import com.casegovernor.aggregation.AggregationFailedException;
import com.casegovernor.context.RecordAccessDeniedException;
import com.casegovernor.context.RecordNotFoundException;
import com.casegovernor.contract.ContractViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error response handler.
 *
 * All errors follow the machine-readable format:
 * {
 *   "error_code": "RECORD_NOT_FOUND",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 *
 * Access-denied responses never echo record details.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final String ACCESS_DENIED_MESSAGE = "you do not have access to this record";

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(RecordNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(RecordNotFoundException ex) {
        return errorResponse("RECORD_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(RecordAccessDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleAccessDenied(RecordAccessDeniedException ex) {
        log.warn("Access denied type={}", ex.getType());
        return errorResponse("ACCESS_DENIED", ACCESS_DENIED_MESSAGE);
    }

    @ExceptionHandler(AggregationFailedException.class)
    public ResponseEntity<Map<String, Object>> handleAggregationFailed(AggregationFailedException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof RecordNotFoundException notFound) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(handleNotFound(notFound));
        }
        if (cause instanceof RecordAccessDeniedException denied) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(handleAccessDenied(denied));
        }
        log.error("Aggregation failed case={}", ex.getCaseId(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(errorResponse("AGGREGATION_FAILED", "case data could not be loaded for " + ex.getCaseId()));
    }

    @ExceptionHandler(ContractViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleContractViolation(ContractViolationException ex) {
        log.warn("Contract violation: {}", ex.getMessage());
        return errorResponse("CONTRACT_VIOLATION", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleIllegalState(IllegalStateException ex) {
        return errorResponse("INVALID_STATE", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", clock.instant().toString());
        return body;
    }
}
