package org.openphc.insight.realtime.backlog;

import java.time.OffsetDateTime;

/**
 * Read-only view of one scope's retained entries, enough to apply a retention policy.
 */
public interface ScopeStats {

    long count();

    /** Sequence at a zero-based position in ascending order. */
    long sequenceAt(int offset);

    /** Highest sequence appended strictly before {@code cutoff}, 0 if none. */
    long maxSequenceAppendedBefore(OffsetDateTime cutoff);
}
