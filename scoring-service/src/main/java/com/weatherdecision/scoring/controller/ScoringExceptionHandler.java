package com.weatherdecision.scoring.controller;

import com.weatherdecision.common.exception.ConfigurationException;
import com.weatherdecision.common.exception.ValidationException;
import com.weatherdecision.scoring.ingest.IngestionUnavailableException;
import com.weatherdecision.scoring.ingest.TransientNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Renders domain failures as JSON error bodies.
 *
 * <ul>
 *   <li>{@link ValidationException}, {@link ConfigurationException}, {@link IllegalArgumentException} → 400</li>
 *   <li>{@link TransientNetworkException}, {@link IngestionUnavailableException} → 503</li>
 * </ul>
 *
 * <p>Anything else, {@link IllegalStateException} included, is left to the default 500 handling.
 */
@RestControllerAdvice
public class ScoringExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ScoringExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        log.warn("Rejected sample: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getSubject(), ex.getMessage());
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException ex) {
        log.warn("Rejected profile: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "CONFIGURATION_ERROR", ex.getKey(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", null, ex.getMessage());
    }

    @ExceptionHandler(TransientNetworkException.class)
    public ResponseEntity<ErrorResponse> handleTransient(TransientNetworkException ex) {
        log.error("Sample source unavailable: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "SOURCE_UNAVAILABLE", ex.getSubject(), ex.getMessage());
    }

    @ExceptionHandler(IngestionUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleIngestionUnavailable(IngestionUnavailableException ex) {
        log.warn("Refresh rejected: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "UNAVAILABLE", ex.getSubject(), ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String subject, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, subject, message, Instant.now()));
    }
}
