package org.openphc.insight.realtime.backlog;

import org.openphc.insight.realtime.config.RealtimeProperties;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.OptionalLong;

/**
 * Decides how far a scope may be evicted.
 * <p>
 * Soft bounds (age and entry count) never pass the oldest connected subscriber's cursor for the
 * scope. Hard bounds apply regardless; a subscriber whose cursor falls behind them gets
 * {@code resync_required} on its next replay.
 */
public class RetentionPolicy {

    private final Duration retention;
    private final int maxEntries;
    private final Duration hardRetention;
    private final int hardMaxEntries;

    public RetentionPolicy(Duration retention, int maxEntries, Duration hardRetention, int hardMaxEntries) {
        if (hardRetention.compareTo(retention) < 0 || hardMaxEntries < maxEntries) {
            throw new IllegalArgumentException("Hard retention bounds must not be tighter than soft bounds");
        }
        this.retention = retention;
        this.maxEntries = maxEntries;
        this.hardRetention = hardRetention;
        this.hardMaxEntries = hardMaxEntries;
    }

    public static RetentionPolicy from(RealtimeProperties.Backlog backlog) {
        return new RetentionPolicy(backlog.getRetention(), backlog.getMaxEntriesPerScope(),
                backlog.getHardRetention(), backlog.getHardMaxEntriesPerScope());
    }

    public Decision decide(ScopeStats stats, OptionalLong protectedCursor, OffsetDateTime now) {
        if (stats.count() == 0) {
            return Decision.NONE;
        }
        long soft = Math.max(
                stats.maxSequenceAppendedBefore(now.minus(retention)),
                countBound(stats, maxEntries));
        long hard = Math.max(
                stats.maxSequenceAppendedBefore(now.minus(hardRetention)),
                countBound(stats, hardMaxEntries));
        long softAllowed = protectedCursor.isPresent()
                ? Math.min(soft, protectedCursor.getAsLong())
                : soft;
        long through = Math.max(softAllowed, hard);
        return new Decision(through, hard > softAllowed);
    }

    private static long countBound(ScopeStats stats, int limit) {
        long count = stats.count();
        if (count <= limit) {
            return 0L;
        }
        return stats.sequenceAt((int) (count - limit - 1));
    }

    /**
     * @param evictThrough   entries with {@code sequence <= evictThrough} go; 0 means none
     * @param hardBoundHit   the hard bound pushed eviction past what soft bounds allowed
     */
    public record Decision(long evictThrough, boolean hardBoundHit) {

        static final Decision NONE = new Decision(0L, false);

        public boolean evicts(long currentWatermark) {
            return evictThrough > currentWatermark;
        }
    }
}
