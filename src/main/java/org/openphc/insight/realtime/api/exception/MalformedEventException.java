package org.openphc.insight.realtime.api.exception;

import lombok.Getter;

/**
 * An upstream notification failed validation. It is logged, counted and dropped.
 */
@Getter
public class MalformedEventException extends RuntimeException {

    private final String field;

    public MalformedEventException(String message, String field) {
        super(message);
        this.field = field;
    }
}
