package com.rfid.positioning.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.rfid.positioning.exception.MissingFeatureValueException;
import com.rfid.positioning.exception.PositioningConfigurationException;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@DisplayName("Global Exception Handler Tests")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("should render configuration errors as 400")
    void shouldRenderConfigurationError() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleConfigurationException(new PositioningConfigurationException("bad window"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(400, response.getBody().get("status"));
        assertEquals("bad window", response.getBody().get("message"));
        assertNotNull(response.getBody().get("timestamp"));
    }

    @Test
    @DisplayName("should render missing feature values as 422 with tag and feature")
    void shouldRenderMissingFeatureValue() {
        ResponseEntity<Map<String, Object>> response = handler.handleMissingFeatureValue(
                new MissingFeatureValueException("T9", Instant.EPOCH, "avg_rc_antenna3"));

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals("T9", response.getBody().get("tagId"));
        assertEquals("avg_rc_antenna3", response.getBody().get("feature"));
    }

    @Test
    @DisplayName("should hide details of unexpected errors")
    void shouldHideUnexpectedErrorDetails() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleGenericException(new IllegalStateException("secret"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("An unexpected error occurred", response.getBody().get("message"));
    }

    @Test
    @DisplayName("should render illegal arguments as 400")
    void shouldRenderIllegalArgument() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleIllegalArgumentException(new IllegalArgumentException("Unknown tag: X"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Bad Request", response.getBody().get("error"));
    }
}
