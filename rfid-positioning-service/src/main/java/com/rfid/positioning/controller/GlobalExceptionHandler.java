package com.rfid.positioning.controller;

import com.rfid.positioning.exception.MissingFeatureValueException;
import com.rfid.positioning.exception.PositioningConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the positioning service.
 * Provides consistent error responses and logging.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String TIMESTAMP = "timestamp";
    private static final String STATUS = "status";
    private static final String ERROR = "error";
    private static final String MESSAGE = "message";

    /**
     * Handles validation errors from @Valid annotations.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            fieldErrors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> errorResponse = body(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed");
        errorResponse.put("fieldErrors", fieldErrors);

        log.warn("Validation error: {}", fieldErrors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    /**
     * Handles unreadable request bodies, including entities rejected by their own invariants.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableMessage(HttpMessageNotReadableException ex) {
        String message = ex.getMostSpecificCause().getMessage();
        log.warn("Unreadable request: {}", message);
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "Bad Request", message));
    }

    /**
     * Handles invalid pipeline configuration (empty reference set, feature count out of bounds,
     * non-positive window sizes).
     */
    @ExceptionHandler(PositioningConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfigurationException(PositioningConfigurationException ex) {
        log.warn("Positioning configuration error: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(body(HttpStatus.BAD_REQUEST, "Positioning Configuration Error", ex.getMessage()));
    }

    /**
     * Handles feature gaps in rows selected for training or prediction.
     */
    @ExceptionHandler(MissingFeatureValueException.class)
    public ResponseEntity<Map<String, Object>> handleMissingFeatureValue(MissingFeatureValueException ex) {
        Map<String, Object> errorResponse =
                body(HttpStatus.UNPROCESSABLE_ENTITY, "Missing Feature Value", ex.getMessage());
        errorResponse.put("tagId", ex.getTagId());
        errorResponse.put("feature", ex.getFeatureName());

        log.warn("Missing feature value: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(errorResponse);
    }

    /**
     * Handles illegal argument exceptions (business validation errors).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Business validation error: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage()));
    }

    /**
     * Handles all other unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred"));
    }

    private Map<String, Object> body(HttpStatus status, String error, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put(TIMESTAMP, Instant.now());
        errorResponse.put(STATUS, status.value());
        errorResponse.put(ERROR, error);
        errorResponse.put(MESSAGE, message);
        return errorResponse;
    }
}
