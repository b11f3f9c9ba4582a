package org.openphc.insight.realtime.backlog;

import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.exception.GapExceededException;
import org.openphc.insight.realtime.domain.model.ChangeEvent;
import org.openphc.insight.realtime.domain.model.ScopeKey;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.NavigableMap;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * Volatile backlog for single-node development and tests. Lost on restart.
 */
@Component
@ConditionalOnProperty(prefix = "insight.backlog", name = "store", havingValue = "memory")
@Slf4j
public class InMemoryReplayStore implements ReplayStore {

    private final Map<ScopeKey, ScopeLog> scopes = new ConcurrentHashMap<>();
    private final Set<String> changeIds = ConcurrentHashMap.newKeySet();
    private final NavigableSet<Long> upstreamGaps = new ConcurrentSkipListSet<>();
    private final Clock clock;

    public InMemoryReplayStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean append(ScopeKey scope, ChangeEvent event) {
        ScopeLog scopeLog = scopes.computeIfAbsent(scope, k -> new ScopeLog());
        synchronized (scopeLog) {
            long sequence = event.getSequence();
            if (sequence <= scopeLog.evictedThrough || scopeLog.entries.containsKey(sequence)) {
                return false;
            }
            scopeLog.entries.put(sequence, new Stored(event, OffsetDateTime.now(clock)));
        }
        if (event.getChangeId() != null) {
            changeIds.add(event.getChangeId());
        }
        return true;
    }

    @Override
    public List<ChangeEvent> replay(ScopeKey scope, long fromSequence) {
        ScopeLog scopeLog = scopes.get(scope);
        if (scopeLog == null) {
            return List.of();
        }
        synchronized (scopeLog) {
            long watermark = Math.max(scopeLog.evictedThrough, scopeLog.missingThrough);
            if (watermark > fromSequence) {
                throw new GapExceededException(scope, fromSequence, watermark);
            }
            List<ChangeEvent> result = new ArrayList<>();
            scopeLog.entries.tailMap(fromSequence, false).values().forEach(s -> result.add(s.event()));
            return result;
        }
    }

    @Override
    public EvictionReport evict(RetentionPolicy policy, Map<ScopeKey, Long> protectedCursors, OffsetDateTime now) {
        EvictionReport report = EvictionReport.empty();
        for (Map.Entry<ScopeKey, ScopeLog> e : scopes.entrySet()) {
            ScopeLog scopeLog = e.getValue();
            Long cursor = protectedCursors.get(e.getKey());
            synchronized (scopeLog) {
                RetentionPolicy.Decision decision = policy.decide(scopeLog,
                        cursor == null ? OptionalLong.empty() : OptionalLong.of(cursor), now);
                if (!decision.evicts(scopeLog.evictedThrough)) {
                    continue;
                }
                NavigableMap<Long, Stored> head = scopeLog.entries.headMap(decision.evictThrough(), true);
                int removed = head.size();
                head.values().forEach(s -> {
                    if (s.event().getChangeId() != null) {
                        changeIds.remove(s.event().getChangeId());
                    }
                });
                head.clear();
                scopeLog.evictedThrough = decision.evictThrough();
                report = report.plus(removed, decision.hardBoundHit());
                log.debug("Evicted {} entries of scope {} through {}", removed, e.getKey(), decision.evictThrough());
            }
        }
        return report;
    }

    @Override
    public boolean containsChange(String changeId) {
        return changeId != null && changeIds.contains(changeId);
    }

    @Override
    public long evictedThrough(ScopeKey scope) {
        ScopeLog scopeLog = scopes.get(scope);
        if (scopeLog == null) {
            return 0L;
        }
        synchronized (scopeLog) {
            return scopeLog.evictedThrough;
        }
    }

    @Override
    public void markMissing(ScopeKey scope, long sequence) {
        ScopeLog scopeLog = scopes.computeIfAbsent(scope, k -> new ScopeLog());
        synchronized (scopeLog) {
            scopeLog.missingThrough = Math.max(scopeLog.missingThrough, sequence);
        }
    }

    @Override
    public void recordUpstreamGap(long lastSequence, String reason, OffsetDateTime detectedAt) {
        upstreamGaps.add(lastSequence);
    }

    @Override
    public OptionalLong upstreamGapWithin(long fromExclusive, long throughInclusive) {
        Long latest = upstreamGaps.floor(throughInclusive);
        return latest != null && latest > fromExclusive ? OptionalLong.of(latest) : OptionalLong.empty();
    }

    /** Retained entry count of a scope. */
    public int size(ScopeKey scope) {
        ScopeLog scopeLog = scopes.get(scope);
        if (scopeLog == null) {
            return 0;
        }
        synchronized (scopeLog) {
            return scopeLog.entries.size();
        }
    }

    private record Stored(ChangeEvent event, OffsetDateTime appendedAt) {
    }

    private static final class ScopeLog implements ScopeStats {
        private final TreeMap<Long, Stored> entries = new TreeMap<>();
        private long evictedThrough;
        private long missingThrough;

        @Override
        public long count() {
            return entries.size();
        }

        @Override
        public long sequenceAt(int offset) {
            int i = 0;
            for (Long sequence : entries.keySet()) {
                if (i++ == offset) {
                    return sequence;
                }
            }
            throw new IndexOutOfBoundsException("offset " + offset + " of " + entries.size());
        }

        @Override
        public long maxSequenceAppendedBefore(OffsetDateTime cutoff) {
            long max = 0L;
            for (Map.Entry<Long, Stored> e : entries.entrySet()) {
                if (e.getValue().appendedAt().isBefore(cutoff)) {
                    max = e.getKey();
                }
            }
            return max;
        }
    }
}
