package org.openphc.insight.realtime.api.exception;

/**
 * Exception thrown when no live subscriber is registered under a connection id.
 */
public class UnknownSubscriberException extends RuntimeException {

    public UnknownSubscriberException(String connectionId) {
        super("Unknown subscriber: " + connectionId);
    }
}
