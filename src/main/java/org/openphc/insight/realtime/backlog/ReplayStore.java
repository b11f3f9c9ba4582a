package org.openphc.insight.realtime.backlog;

import org.openphc.insight.realtime.api.exception.GapExceededException;
import org.openphc.insight.realtime.domain.model.ChangeEvent;
import org.openphc.insight.realtime.domain.model.ScopeKey;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Bounded per-scope history of routed events, used to bring reconnecting subscribers up to date.
 */
public interface ReplayStore {

    /**
     * Appends an event to its scope. Idempotent on {@code (scope, sequence)}.
     *
     * @return false when the entry was already present
     */
    boolean append(ScopeKey scope, ChangeEvent event);

    /**
     * Events of the scope with {@code sequence > fromSequence}, ascending.
     *
     * @throws GapExceededException when entries after {@code fromSequence} were evicted or
     *                              marked missing
     */
    List<ChangeEvent> replay(ScopeKey scope, long fromSequence);

    /**
     * Applies the retention policy to every scope. Soft bounds stop at the cursor in
     * {@code protectedCursors} for that scope.
     */
    EvictionReport evict(RetentionPolicy policy, Map<ScopeKey, Long> protectedCursors, OffsetDateTime now);

    boolean containsChange(String changeId);

    /** Highest evicted sequence of the scope, 0 if nothing was evicted. */
    long evictedThrough(ScopeKey scope);

    /**
     * Records that {@code sequence} never made it into the scope. Replays starting before it
     * raise {@link GapExceededException} until eviction passes it.
     */
    void markMissing(ScopeKey scope, long sequence);

    /** Records that upstream changes after {@code lastSequence} were lost for good. */
    void recordUpstreamGap(long lastSequence, String reason, OffsetDateTime detectedAt);

    /**
     * Highest recorded upstream gap with {@code fromExclusive < lastSequence <= throughInclusive},
     * if any.
     */
    OptionalLong upstreamGapWithin(long fromExclusive, long throughInclusive);
}
