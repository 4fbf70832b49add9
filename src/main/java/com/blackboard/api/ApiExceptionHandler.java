package com.blackboard.api;

import com.blackboard.contract.FactValidationException;
import com.blackboard.coordinator.InvalidRunConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Machine-readable error bodies:
 * {
 *   "error_code": "INVALID_ARGUMENT",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 *
 * Stalled and timed-out runs are not errors here; they come back as reports.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(FactValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleFactValidation(FactValidationException ex) {
        log.warn("Fact validation failed: {}", ex.getMessage());
        return errorResponse("FACT_VALIDATION", ex.getMessage());
    }

    /**
     * Run limits or roster rejected before the run started; nothing was appended.
     */
    @ExceptionHandler(InvalidRunConfigurationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidConfiguration(InvalidRunConfigurationException ex) {
        log.info("Run rejected: {}", ex.getMessage());
        return errorResponse("INVALID_CONFIGURATION", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
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
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
