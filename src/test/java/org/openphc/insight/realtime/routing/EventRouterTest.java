package org.openphc.insight.realtime.routing;

import org.junit.jupiter.api.Test;
import org.openphc.insight.realtime.backlog.ReplayStore;
import org.openphc.insight.realtime.domain.model.ChangeEvent;
import org.openphc.insight.realtime.domain.model.GapMarker;
import org.openphc.insight.realtime.domain.model.ScopeKey;
import org.openphc.insight.realtime.domain.model.enums.MessageType;
import org.openphc.insight.realtime.support.FakeClientConnection;
import org.openphc.insight.realtime.support.TestEvents;
import org.openphc.insight.realtime.support.TestPipeline;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventRouterTest {

    private final TestPipeline pipeline = new TestPipeline(10).acceptToken("alice").acceptToken("bob");

    @Test
    void shouldAppendEveryEventToItsScope() {
        pipeline.router.route(TestEvents.event(1, "p-1"));
        pipeline.router.route(TestEvents.event(2, "p-2"));

        assertEquals(1, pipeline.store.size(new ScopeKey(TestEvents.TENANT, "p-1")));
        assertEquals(1, pipeline.store.size(new ScopeKey(TestEvents.TENANT, "p-2")));
        assertEquals(2L, pipeline.sequencer.releasedHigh());
    }

    @Test
    void shouldDeliverOnlyToEligibleSubscribers() {
        pipeline.authorization.grant("alice", TestEvents.TENANT, Set.of("p-1"));
        pipeline.authorization.grant("bob", TestEvents.TENANT, Set.of("p-2"));
        FakeClientConnection alice = pipeline.connect("c1", "alice", null);
        FakeClientConnection bob = pipeline.connect("c2", "bob", null);

        pipeline.router.route(TestEvents.event(1, "p-1"));
        pipeline.router.route(TestEvents.event(2, "p-2"));
        pipeline.router.route(TestEvents.event(3, "tenant-b", "p-1", Map.of("status", "x")));
        pipeline.settle();

        assertEquals(List.of(1L), alice.eventSequences());
        assertEquals(List.of(2L), bob.eventSequences());
    }

    @Test
    void shouldStillDeliverWhenBacklogAppendFails() {
        ReplayStore failing = mock(ReplayStore.class);
        when(failing.append(any(ScopeKey.class), any(ChangeEvent.class)))
                .thenThrow(new DataAccessResourceFailureException("disk full"));
        EventRouter router = new EventRouter(pipeline.registry, failing, pipeline.replayService,
                pipeline.taskFactory, pipeline.sequencer, pipeline.properties, pipeline.meterRegistry);
        pipeline.authorization.grant("alice", TestEvents.TENANT, Set.of("p-1"));
        FakeClientConnection live = pipeline.connect("c1", "alice", null);

        router.route(TestEvents.event(1, "p-1"));
        pipeline.settle();

        assertEquals(List.of(1L), live.eventSequences());

        FakeClientConnection late = pipeline.connect("c2", "alice", 0L);

        assertTrue(late.eventSequences().isEmpty());
        assertEquals(1L, late.sent(MessageType.RESYNC_REQUIRED).get(0).getSequence());
    }

    @Test
    void shouldRefuseSignalsWhenNotRunning() {
        assertThrows(IllegalStateException.class, () -> pipeline.router.submit(TestEvents.event(1, "p-1")));
    }

    @Test
    void shouldRouteSubmittedEventsOnPartitionThreads() throws Exception {
        pipeline.authorization.grant("alice", TestEvents.TENANT, Set.of("p-1", "p-2", "p-3"));
        FakeClientConnection connection = pipeline.connect("c1", "alice", null);
        pipeline.router.start();
        try {
            for (long seq = 1; seq <= 6; seq++) {
                pipeline.router.submit(TestEvents.event(seq, "p-" + (seq % 3 + 1)));
            }
            pipeline.router.submit(GapMarker.builder().lastSequence(6).recoverable(true).build());
        } finally {
            pipeline.router.drain(Duration.ofSeconds(5));
        }
        pipeline.settle();

        assertFalse(pipeline.router.isRunning());
        assertEquals(6L, pipeline.sequencer.releasedHigh());
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L), connection.eventSequences());
    }
}
