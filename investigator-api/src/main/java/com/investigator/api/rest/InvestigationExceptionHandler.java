package com.investigator.api.rest;

import com.investigator.core.exception.InvestigationAbortedException;
import com.investigator.core.exception.InvestigatorException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps investigation failures to HTTP responses.
 * 
 * An investigation that could not run is 503 with code INVESTIGATION_COULD_NOT_RUN,
 * distinct from a 200 response whose outcome is NO_INCIDENT_FOUND.
 */
@RestControllerAdvice
public class InvestigationExceptionHandler {

    static final String COULD_NOT_RUN = "INVESTIGATION_COULD_NOT_RUN";

    private static final Logger log = LoggerFactory.getLogger(InvestigationExceptionHandler.class);

    @ExceptionHandler(InvestigationAbortedException.class)
    public ResponseEntity<Map<String, Object>> handleAborted(InvestigationAbortedException ex) {
        Map<String, Object> response = body(HttpStatus.SERVICE_UNAVAILABLE, COULD_NOT_RUN, ex.getMessage());
        response.put("investigationId", ex.getRecord().investigationId());
        response.put("abortCode", ex.getAbortCode());
        response.put("incidentClass", ex.getRecord().classification().primaryClass().wireName());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    @ExceptionHandler(InvestigatorException.class)
    public ResponseEntity<Map<String, Object>> handleInvestigator(InvestigatorException ex) {
        log.error("Investigation failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest()
            .body(body(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage()));
    }

    private static Map<String, Object> body(HttpStatus status, String code, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now());
        response.put("status", status.value());
        response.put("error", status.getReasonPhrase());
        response.put("code", code);
        response.put("message", message);
        return response;
    }
}
