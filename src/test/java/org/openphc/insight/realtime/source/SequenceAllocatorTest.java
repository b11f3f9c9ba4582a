package org.openphc.insight.realtime.source;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.domain.model.SourceCheckpoint;
import org.openphc.insight.realtime.domain.repository.SourceCheckpointRepository;
import org.openphc.insight.realtime.support.MutableClock;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SequenceAllocatorTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
    private final RealtimeProperties properties = new RealtimeProperties();
    private final Map<String, SourceCheckpoint> rows = new HashMap<>();
    private final SourceCheckpointRepository repository = mock(SourceCheckpointRepository.class);

    @BeforeEach
    void setUp() {
        properties.getSource().setSequenceBlockSize(10);
        when(repository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(rows.get(inv.<String>getArgument(0))));
        when(repository.save(any(SourceCheckpoint.class))).thenAnswer(inv -> {
            SourceCheckpoint saved = inv.getArgument(0);
            rows.put(saved.getSourceId(), SourceCheckpoint.builder()
                    .sourceId(saved.getSourceId())
                    .reservedThrough(saved.getReservedThrough())
                    .lastPosition(saved.getLastPosition())
                    .updatedAt(saved.getUpdatedAt())
                    .build());
            return saved;
        });
    }

    private SequenceAllocator newAllocator() {
        SequenceAllocator allocator = new SequenceAllocator(repository, clock, properties);
        allocator.initialize();
        return allocator;
    }

    @Test
    void shouldStartAtOneOnFreshSource() {
        SequenceAllocator allocator = newAllocator();

        assertEquals(0L, allocator.lastAssigned());
        assertEquals(1L, allocator.next());
        assertEquals(2L, allocator.next());
        assertEquals(2L, allocator.lastAssigned());
        assertNull(allocator.lastPosition());
    }

    @Test
    void shouldReserveOneBlockAtATime() {
        SequenceAllocator allocator = newAllocator();

        for (int i = 0; i < 10; i++) {
            allocator.next();
        }
        assertEquals(10L, rows.get("primary").getReservedThrough());
        verify(repository, times(1)).save(any(SourceCheckpoint.class));

        assertEquals(11L, allocator.next());
        assertEquals(20L, rows.get("primary").getReservedThrough());
    }

    @Test
    void shouldNeverReuseSequencesAfterRestart() {
        SequenceAllocator first = newAllocator();
        first.next();
        first.next();
        first.recordPosition("0/16B3748");

        SequenceAllocator restarted = newAllocator();

        assertEquals(11L, restarted.next());
        assertEquals("0/16B3748", restarted.lastPosition());
    }

    @Test
    void shouldNotPersistUnchangedPosition() {
        SequenceAllocator allocator = newAllocator();
        allocator.recordPosition("5");
        allocator.recordPosition("5");
        allocator.recordPosition(null);

        verify(repository, times(1)).save(any(SourceCheckpoint.class));
    }

    @Test
    void shouldRefuseUseBeforeInitialization() {
        SequenceAllocator allocator = new SequenceAllocator(repository, clock, properties);

        assertThrows(IllegalStateException.class, allocator::next);
    }
}
