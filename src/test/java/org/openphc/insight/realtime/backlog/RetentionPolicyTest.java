package org.openphc.insight.realtime.backlog;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.OptionalLong;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class RetentionPolicyTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-02T00:00:00Z");

    /** Entries as (sequence, hours before NOW). */
    private static ScopeStats stats(long[]... entries) {
        TreeMap<Long, OffsetDateTime> appended = new TreeMap<>();
        for (long[] e : entries) {
            appended.put(e[0], NOW.minusHours(e[1]));
        }
        List<Long> sequences = List.copyOf(appended.keySet());
        return new ScopeStats() {
            @Override
            public long count() {
                return appended.size();
            }

            @Override
            public long sequenceAt(int offset) {
                return sequences.get(offset);
            }

            @Override
            public long maxSequenceAppendedBefore(OffsetDateTime cutoff) {
                return appended.entrySet().stream()
                        .filter(e -> e.getValue().isBefore(cutoff))
                        .mapToLong(e -> e.getKey())
                        .max()
                        .orElse(0L);
            }
        };
    }

    private final RetentionPolicy policy = new RetentionPolicy(Duration.ofHours(24), 3, Duration.ofHours(72), 5);

    @Test
    void shouldKeepEverythingWithinBounds() {
        RetentionPolicy.Decision decision = policy.decide(
                stats(new long[]{1, 5}, new long[]{2, 4}), OptionalLong.empty(), NOW);

        assertFalse(decision.evicts(0L));
    }

    @Test
    void shouldEvictByAge() {
        RetentionPolicy.Decision decision = policy.decide(
                stats(new long[]{1, 30}, new long[]{4, 25}, new long[]{9, 1}), OptionalLong.empty(), NOW);

        assertEquals(4L, decision.evictThrough());
        assertFalse(decision.hardBoundHit());
    }

    @Test
    void shouldEvictByCountKeepingNewest() {
        RetentionPolicy.Decision decision = policy.decide(
                stats(new long[]{1, 1}, new long[]{2, 1}, new long[]{3, 1}, new long[]{4, 1}, new long[]{5, 1}),
                OptionalLong.empty(), NOW);

        assertEquals(2L, decision.evictThrough());
    }

    @Test
    void shouldNotPassConnectedSubscriberCursorOnSoftBounds() {
        RetentionPolicy.Decision decision = policy.decide(
                stats(new long[]{1, 30}, new long[]{4, 25}, new long[]{9, 1}), OptionalLong.of(1L), NOW);

        assertEquals(1L, decision.evictThrough());
        assertFalse(decision.hardBoundHit());
    }

    @Test
    void shouldApplyHardBoundsPastLaggingCursor() {
        RetentionPolicy.Decision decision = policy.decide(
                stats(new long[]{1, 80}, new long[]{2, 75}, new long[]{3, 30}, new long[]{4, 1}),
                OptionalLong.of(0L), NOW);

        assertEquals(2L, decision.evictThrough());
        assertTrue(decision.hardBoundHit());
    }

    @Test
    void shouldDecideNothingForEmptyScope() {
        RetentionPolicy.Decision decision = policy.decide(stats(), OptionalLong.empty(), NOW);

        assertEquals(0L, decision.evictThrough());
    }

    @Test
    void shouldRejectHardBoundsTighterThanSoft() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetentionPolicy(Duration.ofHours(24), 100, Duration.ofHours(12), 100));
        assertThrows(IllegalArgumentException.class,
                () -> new RetentionPolicy(Duration.ofHours(24), 100, Duration.ofHours(48), 50));
    }
}
