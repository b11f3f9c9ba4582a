package org.openphc.insight.realtime.backlog;

import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.exception.GapExceededException;
import org.openphc.insight.realtime.domain.model.BacklogEntry;
import org.openphc.insight.realtime.domain.model.BacklogScope;
import org.openphc.insight.realtime.domain.model.ChangeEvent;
import org.openphc.insight.realtime.domain.model.ScopeKey;
import org.openphc.insight.realtime.domain.model.UpstreamGap;
import org.openphc.insight.realtime.domain.repository.BacklogEntryRepository;
import org.openphc.insight.realtime.domain.repository.BacklogScopeRepository;
import org.openphc.insight.realtime.domain.repository.UpstreamGapRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Durable backlog in PostgreSQL. Entries live in {@code backlog_entry}; each scope's eviction
 * and missing watermarks live in {@code backlog_scope} so replay can tell evicted ranges from
 * empty ones. Lost upstream ranges are kept in {@code upstream_gap}.
 */
@Component
@ConditionalOnProperty(prefix = "insight.backlog", name = "store", havingValue = "jpa", matchIfMissing = true)
@Slf4j
public class JpaReplayStore implements ReplayStore {

    private final BacklogEntryRepository entryRepository;
    private final BacklogScopeRepository scopeRepository;
    private final UpstreamGapRepository gapRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JpaReplayStore(BacklogEntryRepository entryRepository,
                          BacklogScopeRepository scopeRepository,
                          UpstreamGapRepository gapRepository,
                          PlatformTransactionManager transactionManager,
                          Clock clock) {
        this.entryRepository = entryRepository;
        this.scopeRepository = scopeRepository;
        this.gapRepository = gapRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    public boolean append(ScopeKey scope, ChangeEvent event) {
        if (entryRepository.existsByScopeKeyAndSequence(scope.asString(), event.getSequence())) {
            log.debug("Backlog already holds {} #{}", scope, event.getSequence());
            return false;
        }
        entryRepository.save(BacklogEntry.from(scope, event, OffsetDateTime.now(clock)));
        return true;
    }

    @Override
    public List<ChangeEvent> replay(ScopeKey scope, long fromSequence) {
        long watermark = scopeRepository.findById(scope.asString())
                .map(row -> Math.max(row.getEvictedThrough(), row.getMissingThrough()))
                .orElse(0L);
        if (watermark > fromSequence) {
            throw new GapExceededException(scope, fromSequence, watermark);
        }
        return entryRepository
                .findByScopeKeyAndSequenceGreaterThanOrderBySequenceAsc(scope.asString(), fromSequence)
                .stream()
                .map(BacklogEntry::toChangeEvent)
                .toList();
    }

    @Override
    public EvictionReport evict(RetentionPolicy policy, Map<ScopeKey, Long> protectedCursors, OffsetDateTime now) {
        EvictionReport report = EvictionReport.empty();
        for (String key : entryRepository.findDistinctScopeKeys()) {
            ScopeKey scope = ScopeKey.parse(key);
            try {
                Long cursor = protectedCursors.get(scope);
                RetentionPolicy.Decision decision = policy.decide(new RepositoryScopeStats(key),
                        cursor == null ? OptionalLong.empty() : OptionalLong.of(cursor), now);
                BacklogScope row = scopeRow(key, now);
                if (!decision.evicts(row.getEvictedThrough())) {
                    continue;
                }
                Integer deleted = transactionTemplate.execute(status -> {
                    int removed = entryRepository.deleteThrough(key, decision.evictThrough());
                    row.setEvictedThrough(decision.evictThrough());
                    row.setUpdatedAt(now);
                    scopeRepository.save(row);
                    return removed;
                });
                report = report.plus(deleted == null ? 0 : deleted, decision.hardBoundHit());
                log.debug("Evicted {} entries of scope {} through {}", deleted, scope, decision.evictThrough());
            } catch (DataAccessException e) {
                log.error("Eviction failed for scope {}: {}", scope, e.getMessage());
                report = report.plusFailure();
            }
        }
        return report;
    }

    @Override
    public boolean containsChange(String changeId) {
        return changeId != null && entryRepository.existsByChangeId(changeId);
    }

    @Override
    public long evictedThrough(ScopeKey scope) {
        return scopeRepository.findById(scope.asString())
                .map(BacklogScope::getEvictedThrough)
                .orElse(0L);
    }

    @Override
    public void markMissing(ScopeKey scope, long sequence) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        transactionTemplate.executeWithoutResult(status -> {
            BacklogScope row = scopeRow(scope.asString(), now);
            if (sequence > row.getMissingThrough()) {
                row.setMissingThrough(sequence);
                row.setUpdatedAt(now);
                scopeRepository.save(row);
            }
        });
    }

    @Override
    public void recordUpstreamGap(long lastSequence, String reason, OffsetDateTime detectedAt) {
        gapRepository.save(UpstreamGap.builder()
                .lastSequence(lastSequence)
                .reason(reason)
                .detectedAt(detectedAt == null ? OffsetDateTime.now(clock) : detectedAt)
                .build());
    }

    @Override
    public OptionalLong upstreamGapWithin(long fromExclusive, long throughInclusive) {
        Long latest = gapRepository.findLatestWithin(fromExclusive, throughInclusive);
        return latest == null ? OptionalLong.empty() : OptionalLong.of(latest);
    }

    private BacklogScope scopeRow(String key, OffsetDateTime now) {
        return scopeRepository.findById(key).orElseGet(() -> BacklogScope.builder()
                .scopeKey(key)
                .updatedAt(now)
                .build());
    }

    private final class RepositoryScopeStats implements ScopeStats {

        private final String scopeKey;
        private Long count;

        private RepositoryScopeStats(String scopeKey) {
            this.scopeKey = scopeKey;
        }

        @Override
        public long count() {
            if (count == null) {
                count = entryRepository.countByScopeKey(scopeKey);
            }
            return count;
        }

        @Override
        public long sequenceAt(int offset) {
            List<Long> page = entryRepository.findSequencesByScopeKey(scopeKey, PageRequest.of(offset, 1));
            if (page.isEmpty()) {
                throw new IndexOutOfBoundsException("offset " + offset + " of scope " + scopeKey);
            }
            return page.get(0);
        }

        @Override
        public long maxSequenceAppendedBefore(OffsetDateTime cutoff) {
            Long max = entryRepository.findMaxSequenceAppendedBefore(scopeKey, cutoff);
            return max == null ? 0L : max;
        }
    }
}
