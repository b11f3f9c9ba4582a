package org.openphc.insight.realtime.api.exception;

import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.dto.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps operator API failures onto the {@link ApiResponse} error envelope.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnknownSubscriberException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnknownSubscriber(UnknownSubscriberException ex) {
        log.warn("{}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("UNKNOWN_SUBSCRIBER", ex.getMessage()));
    }

    @ExceptionHandler(AuthorizationStaleException.class)
    public ResponseEntity<ApiResponse<Void>> handleAuthorizationStale(AuthorizationStaleException ex) {
        log.warn("Authorization refresh failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error("AUTHORIZATION_UNAVAILABLE",
                        "Authorization source unavailable; last-known snapshot kept"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("INTERNAL_ERROR", "An unexpected error occurred"));
    }
}
