package org.openphc.insight.realtime.backlog;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.openphc.insight.realtime.api.exception.GapExceededException;
import org.openphc.insight.realtime.domain.model.BacklogEntry;
import org.openphc.insight.realtime.domain.model.BacklogScope;
import org.openphc.insight.realtime.domain.model.ChangeEvent;
import org.openphc.insight.realtime.domain.model.ScopeKey;
import org.openphc.insight.realtime.domain.model.UpstreamGap;
import org.openphc.insight.realtime.domain.repository.BacklogEntryRepository;
import org.openphc.insight.realtime.domain.repository.BacklogScopeRepository;
import org.openphc.insight.realtime.domain.repository.UpstreamGapRepository;
import org.openphc.insight.realtime.support.MutableClock;
import org.openphc.insight.realtime.support.TestEvents;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class JpaReplayStoreTest {

    private static final ScopeKey SCOPE = new ScopeKey(TestEvents.TENANT, "p-1");
    private static final String KEY = SCOPE.asString();

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
    private BacklogEntryRepository entryRepository;
    private BacklogScopeRepository scopeRepository;
    private UpstreamGapRepository gapRepository;
    private JpaReplayStore store;

    @BeforeEach
    void setUp() {
        entryRepository = mock(BacklogEntryRepository.class);
        scopeRepository = mock(BacklogScopeRepository.class);
        gapRepository = mock(UpstreamGapRepository.class);
        store = new JpaReplayStore(entryRepository, scopeRepository, gapRepository,
                mock(PlatformTransactionManager.class), clock);
    }

    private static BacklogEntry entry(long sequence) {
        return BacklogEntry.from(SCOPE, TestEvents.event(sequence, "p-1"), OffsetDateTime.parse("2026-03-01T11:00:00Z"));
    }

    private void watermark(long evictedThrough) {
        watermarks(evictedThrough, 0L);
    }

    private BacklogScope watermarks(long evictedThrough, long missingThrough) {
        BacklogScope row = BacklogScope.builder()
                .scopeKey(KEY)
                .evictedThrough(evictedThrough)
                .missingThrough(missingThrough)
                .updatedAt(OffsetDateTime.now(clock))
                .build();
        when(scopeRepository.findById(KEY)).thenReturn(Optional.of(row));
        return row;
    }

    @Test
    void shouldSaveNewEntryWithAppendTime() {
        when(entryRepository.existsByScopeKeyAndSequence(KEY, 4L)).thenReturn(false);

        assertTrue(store.append(SCOPE, TestEvents.event(4, "p-1")));

        ArgumentCaptor<BacklogEntry> saved = ArgumentCaptor.forClass(BacklogEntry.class);
        verify(entryRepository).save(saved.capture());
        assertEquals(KEY, saved.getValue().getScopeKey());
        assertEquals(4L, saved.getValue().getSequence());
        assertEquals(OffsetDateTime.now(clock), saved.getValue().getAppendedAt());
    }

    @Test
    void shouldSkipExistingEntry() {
        when(entryRepository.existsByScopeKeyAndSequence(KEY, 4L)).thenReturn(true);

        assertFalse(store.append(SCOPE, TestEvents.event(4, "p-1")));
        verify(entryRepository, never()).save(any());
    }

    @Test
    void shouldReplayStoredEventsWhenWatermarkAllows() {
        watermark(2L);
        when(entryRepository.findByScopeKeyAndSequenceGreaterThanOrderBySequenceAsc(KEY, 2L))
                .thenReturn(List.of(entry(3), entry(5)));

        List<ChangeEvent> events = store.replay(SCOPE, 2L);

        assertEquals(List.of(3L, 5L), events.stream().map(ChangeEvent::getSequence).toList());
        assertEquals("p-1", events.get(0).getPatientId());
    }

    @Test
    void shouldRaiseGapExceededBehindWatermark() {
        watermark(2L);

        assertThrows(GapExceededException.class, () -> store.replay(SCOPE, 1L));
        verify(entryRepository, never()).findByScopeKeyAndSequenceGreaterThanOrderBySequenceAsc(anyString(), anyLong());
    }

    @Test
    void shouldRaiseGapExceededBehindMissingWatermark() {
        watermarks(0L, 4L);

        GapExceededException ex = assertThrows(GapExceededException.class, () -> store.replay(SCOPE, 3L));
        assertEquals(4L, ex.getBoundary());
    }

    @Test
    void shouldPersistMissingSequenceOnNewScopeRow() {
        when(scopeRepository.findById(KEY)).thenReturn(Optional.empty());

        store.markMissing(SCOPE, 6L);

        ArgumentCaptor<BacklogScope> saved = ArgumentCaptor.forClass(BacklogScope.class);
        verify(scopeRepository).save(saved.capture());
        assertEquals(6L, saved.getValue().getMissingThrough());
        assertEquals(0L, saved.getValue().getEvictedThrough());
    }

    @Test
    void shouldNotLowerMissingWatermark() {
        watermarks(0L, 9L);

        store.markMissing(SCOPE, 6L);

        verify(scopeRepository, never()).save(any());
    }

    @Test
    void shouldRecordAndQueryUpstreamGaps() {
        OffsetDateTime detected = OffsetDateTime.now(clock);
        when(gapRepository.findLatestWithin(1L, 5L)).thenReturn(3L);
        when(gapRepository.findLatestWithin(3L, 5L)).thenReturn(null);

        store.recordUpstreamGap(3L, "notification log truncated", detected);

        ArgumentCaptor<UpstreamGap> saved = ArgumentCaptor.forClass(UpstreamGap.class);
        verify(gapRepository).save(saved.capture());
        assertEquals(3L, saved.getValue().getLastSequence());
        assertEquals(detected, saved.getValue().getDetectedAt());
        assertEquals(OptionalLong.of(3L), store.upstreamGapWithin(1L, 5L));
        assertEquals(OptionalLong.empty(), store.upstreamGapWithin(3L, 5L));
    }

    @Test
    void shouldTreatUnknownScopeAsNeverEvicted() {
        when(scopeRepository.findById(KEY)).thenReturn(Optional.empty());

        assertEquals(0L, store.evictedThrough(SCOPE));
    }

    @Test
    void shouldDeleteThroughDecisionAndRecordWatermark() {
        when(entryRepository.findDistinctScopeKeys()).thenReturn(List.of(KEY));
        when(entryRepository.countByScopeKey(KEY)).thenReturn(5L);
        when(entryRepository.findSequencesByScopeKey(eq(KEY), any(Pageable.class))).thenReturn(List.of(3L));
        when(entryRepository.findMaxSequenceAppendedBefore(eq(KEY), any())).thenReturn(null);
        when(scopeRepository.findById(KEY)).thenReturn(Optional.empty());
        when(entryRepository.deleteThrough(KEY, 3L)).thenReturn(3);

        EvictionReport report = store.evict(new RetentionPolicy(Duration.ofDays(1), 2, Duration.ofDays(7), 10),
                Map.of(), OffsetDateTime.now(clock));

        assertEquals(1, report.scopesEvicted());
        assertEquals(3L, report.entriesEvicted());
        ArgumentCaptor<BacklogScope> scope = ArgumentCaptor.forClass(BacklogScope.class);
        verify(scopeRepository).save(scope.capture());
        assertEquals(3L, scope.getValue().getEvictedThrough());
    }

    @Test
    void shouldKeepMissingWatermarkWhenEvicting() {
        when(entryRepository.findDistinctScopeKeys()).thenReturn(List.of(KEY));
        when(entryRepository.countByScopeKey(KEY)).thenReturn(5L);
        when(entryRepository.findSequencesByScopeKey(eq(KEY), any(Pageable.class))).thenReturn(List.of(3L));
        when(entryRepository.findMaxSequenceAppendedBefore(eq(KEY), any())).thenReturn(null);
        watermarks(0L, 8L);

        store.evict(new RetentionPolicy(Duration.ofDays(1), 2, Duration.ofDays(7), 10),
                Map.of(), OffsetDateTime.now(clock));

        ArgumentCaptor<BacklogScope> scope = ArgumentCaptor.forClass(BacklogScope.class);
        verify(scopeRepository).save(scope.capture());
        assertEquals(3L, scope.getValue().getEvictedThrough());
        assertEquals(8L, scope.getValue().getMissingThrough());
    }

    @Test
    void shouldCountFailedScopeAndContinue() {
        when(entryRepository.findDistinctScopeKeys()).thenReturn(List.of(KEY, "tenant-a:p-2"));
        when(entryRepository.countByScopeKey(KEY)).thenThrow(new DataAccessResourceFailureException("timeout"));
        when(entryRepository.countByScopeKey("tenant-a:p-2")).thenReturn(1L);
        when(entryRepository.findMaxSequenceAppendedBefore(anyString(), any())).thenReturn(null);

        EvictionReport report = store.evict(new RetentionPolicy(Duration.ofDays(1), 2, Duration.ofDays(7), 10),
                Map.of(), OffsetDateTime.now(clock));

        assertEquals(1, report.failedScopes());
        assertEquals(0, report.scopesEvicted());
        verify(entryRepository, never()).deleteThrough(anyString(), anyLong());
    }
}
