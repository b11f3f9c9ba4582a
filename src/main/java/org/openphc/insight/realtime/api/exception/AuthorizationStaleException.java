package org.openphc.insight.realtime.api.exception;

/**
 * Authorization could not be reloaded. Callers keep the last-known snapshot.
 */
public class AuthorizationStaleException extends RuntimeException {

    public AuthorizationStaleException(String message, Throwable cause) {
        super(message, cause);
    }
}
