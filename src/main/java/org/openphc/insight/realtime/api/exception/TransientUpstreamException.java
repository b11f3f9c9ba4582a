package org.openphc.insight.realtime.api.exception;

/**
 * The upstream change stream is unreachable or dropped. The source reconnects with backoff.
 */
public class TransientUpstreamException extends RuntimeException {

    public TransientUpstreamException(String message) {
        super(message);
    }

    public TransientUpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
