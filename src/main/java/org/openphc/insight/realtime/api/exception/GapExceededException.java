package org.openphc.insight.realtime.api.exception;

import lombok.Getter;
import org.openphc.insight.realtime.domain.model.ScopeKey;

/**
 * Part of the requested replay range is not in the backlog: it was evicted, an append failed,
 * or upstream changes inside it were lost.
 */
@Getter
public class GapExceededException extends RuntimeException {

    /** Null when the gap is upstream and not tied to one scope. */
    private final ScopeKey scope;
    private final long fromSequence;
    private final long boundary;

    public GapExceededException(ScopeKey scope, long fromSequence, long boundary) {
        this("Backlog for scope " + scope + " no longer covers sequence " + fromSequence
                + " (missing through " + boundary + ")", scope, fromSequence, boundary);
    }

    private GapExceededException(String message, ScopeKey scope, long fromSequence, long boundary) {
        super(message);
        this.scope = scope;
        this.fromSequence = fromSequence;
        this.boundary = boundary;
    }

    public static GapExceededException upstream(long fromSequence, long lastSequence) {
        return new GapExceededException("Upstream changes after sequence " + lastSequence
                + " were lost; replay from " + fromSequence + " cannot be complete", null, fromSequence, lastSequence);
    }
}
