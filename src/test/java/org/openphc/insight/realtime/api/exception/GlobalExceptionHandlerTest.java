package org.openphc.insight.realtime.api.exception;

import org.junit.jupiter.api.Test;
import org.openphc.insight.realtime.api.dto.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapUnknownSubscriberToNotFound() {
        ResponseEntity<ApiResponse<Void>> response =
                handler.handleUnknownSubscriber(new UnknownSubscriberException("c-404"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("UNKNOWN_SUBSCRIBER", response.getBody().getError().getCode());
        assertTrue(response.getBody().getError().getMessage().contains("c-404"));
        assertNull(response.getBody().getData());
    }

    @Test
    void shouldMapStaleAuthorizationToServiceUnavailable() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleAuthorizationStale(
                new AuthorizationStaleException("entitlements down", null));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("AUTHORIZATION_UNAVAILABLE", response.getBody().getError().getCode());
    }

    @Test
    void shouldHideInternalErrorDetails() {
        ResponseEntity<ApiResponse<Void>> response =
                handler.handleGeneric(new IllegalStateException("secret internals"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertFalse(response.getBody().getError().getMessage().contains("secret"));
    }
}
