package org.openphc.insight.realtime.delivery;

import org.junit.jupiter.api.Test;
import org.openphc.insight.realtime.api.dto.ServerMessage;
import org.openphc.insight.realtime.api.exception.ConnectionRejectedException;
import org.openphc.insight.realtime.api.exception.UnknownSubscriberException;
import org.openphc.insight.realtime.domain.model.ScopeKey;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;
import org.openphc.insight.realtime.domain.model.enums.MessageType;
import org.openphc.insight.realtime.routing.RoutedEvent;
import org.openphc.insight.realtime.support.FakeClientConnection;
import org.openphc.insight.realtime.support.TestEvents;
import org.openphc.insight.realtime.support.TestPipeline;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

class SessionManagerTest {

    private final TestPipeline pipeline = new TestPipeline(10).acceptToken("alice").acceptToken("bob");

    private void backlog(long sequence, String patientId) {
        pipeline.store.append(new ScopeKey(TestEvents.TENANT, patientId), TestEvents.event(sequence, patientId));
    }

    // --- Handshake ---

    @Test
    void shouldStartFreshClientAtHead() {
        pipeline.authorization.grant("alice", TestEvents.TENANT, Set.of("p-1"));

        FakeClientConnection connection = pipeline.connect("c1", "alice", null);

        assertTrue(pipeline.registry.find("c1").isPresent());
        List<ServerMessage> sent = connection.sent();
        assertEquals(1, sent.size());
        assertEquals(MessageType.REPLAY_COMPLETE, sent.get(0).getType());
        assertEquals(0L, sent.get(0).getSequence());
    }

    @Test
    void shouldReplayFromClientCursor() {
        pipeline.authorization.grant("alice", TestEvents.TENANT, Set.of("p-1"));
        for (long seq = 1; seq <= 4; seq++) {
            backlog(seq, "p-1");
            pipeline.sequencer.complete(new RoutedEvent(
                    TestEvents.event(seq, "p-1"), pipeline.registry.snapshot().version(), List.of()));
        }

        FakeClientConnection connection = pipeline.connect("c1", "alice", 2L);

        assertEquals(List.of(3L, 4L), connection.eventSequences());
        assertEquals(4L, connection.sent(MessageType.REPLAY_COMPLETE).get(0).getSequence());
        assertEquals(4L, pipeline.registry.find("c1").orElseThrow().cursor());
    }

    @Test
    void shouldResyncClientWhoseCursorIsAheadOfStream() {
        pipeline.authorization.grant("alice", TestEvents.TENANT, Set.of("p-1"));

        FakeClientConnection connection = pipeline.connect("c1", "alice", 99L);

        ServerMessage resync = connection.sent(MessageType.RESYNC_REQUIRED).get(0);
        assertEquals("cursor ahead of stream", resync.getReason());
        assertEquals(0L, resync.getSequence());
        assertFalse(connection.isClosed());
    }

    @Test
    void shouldRejectInvalidToken() {
        when(pipeline.tokenVerifier.verify("forged"))
                .thenThrow(new ConnectionRejectedException("Invalid access token", DisconnectReason.UNAUTHORIZED));
        FakeClientConnection connection = new FakeClientConnection("c1");
        pipeline.sessionManager.opened(connection);

        pipeline.sessionManager.handshake("c1", "forged", null);

        assertEquals(DisconnectReason.UNAUTHORIZED, connection.closedWith());
        assertEquals(MessageType.ERROR, connection.sent().get(0).getType());
        assertTrue(pipeline.registry.find("c1").isEmpty());
        assertNull(pipeline.channels.get("c1"));
    }

    @Test
    void shouldRejectWhenAuthorizationUnavailable() {
        pipeline.authorization.setUnavailable(true);

        FakeClientConnection connection = pipeline.connect("c1", "alice", null);

        assertEquals(DisconnectReason.AUTHORIZATION_UNAVAILABLE, connection.closedWith());
        assertEquals(0, pipeline.registry.snapshot().size());
    }

    @Test
    void shouldCloseDuplicateConnectFrame() {
        pipeline.authorization.grant("alice", TestEvents.TENANT, Set.of("p-1"));
        FakeClientConnection connection = pipeline.connect("c1", "alice", null);

        pipeline.sessionManager.handshake("c1", "token-alice", null);

        assertEquals(DisconnectReason.PROTOCOL_ERROR, connection.closedWith());
        assertTrue(pipeline.registry.find("c1").isEmpty());
    }

    @Test
    void shouldSupersedeOtherSessionsWhenExclusive() {
        pipeline.properties.getDelivery().setExclusiveSessions(true);
        pipeline.authorization.grant("alice", TestEvents.TENANT, Set.of("p-1"));
        FakeClientConnection first = pipeline.connect("c1", "alice", null);

        FakeClientConnection second = pipeline.connect("c2", "alice", null);

        assertEquals(DisconnectReason.SUPERSEDED, first.closedWith());
        assertFalse(second.isClosed());
        assertEquals(1, pipeline.registry.snapshot().size());
    }

    @Test
    void shouldAllowConcurrentSessionsByDefault() {
        pipeline.authorization.grant("alice", TestEvents.TENANT, Set.of("p-1"));

        FakeClientConnection first = pipeline.connect("c1", "alice", null);
        FakeClientConnection second = pipeline.connect("c2", "alice", null);

        assertFalse(first.isClosed());
        assertFalse(second.isClosed());
        assertEquals(2, pipeline.registry.snapshot().size());
    }

    // --- After the handshake ---

    @Test
    void shouldTreatAckBeforeConnectAsProtocolError() {
        FakeClientConnection connection = new FakeClientConnection("c1");
        pipeline.sessionManager.opened(connection);

        pipeline.sessionManager.acknowledge("c1", 3L);

        assertEquals(DisconnectReason.PROTOCOL_ERROR, connection.closedWith());
        assertEquals(0, pipeline.sessionManager.pendingCount());
    }

    @Test
    void shouldExpireUnfinishedHandshakes() {
        FakeClientConnection connection = new FakeClientConnection("c1");
        pipeline.sessionManager.opened(connection);

        assertEquals(0, pipeline.sessionManager.expireHandshakes(pipeline.clock.instant()));
        pipeline.clock.advance(Duration.ofSeconds(11));

        assertEquals(1, pipeline.sessionManager.expireHandshakes(pipeline.clock.instant()));
        assertEquals(DisconnectReason.HANDSHAKE_TIMEOUT, connection.closedWith());
    }

    @Test
    void shouldDeregisterWhenTransportCloses() {
        pipeline.authorization.grant("alice", TestEvents.TENANT, Set.of("p-1"));
        pipeline.connect("c1", "alice", null);

        pipeline.sessionManager.closed("c1", DisconnectReason.CLIENT_CLOSED);

        assertTrue(pipeline.registry.find("c1").isEmpty());
        assertNull(pipeline.channels.get("c1"));
        assertEquals(1.0, pipeline.meterRegistry.counter("insight.delivery.disconnects", "reason", "client_closed").count());
    }

    @Test
    void shouldDisconnectOnOperatorRequest() {
        pipeline.authorization.grant("bob", TestEvents.TENANT, Set.of("p-1"));
        FakeClientConnection connection = pipeline.connect("c1", "bob", null);

        pipeline.sessionManager.disconnect("c1", DisconnectReason.OPERATOR);

        assertEquals(DisconnectReason.OPERATOR, connection.closedWith());
        assertThrows(UnknownSubscriberException.class,
                () -> pipeline.sessionManager.disconnect("c1", DisconnectReason.OPERATOR));
    }

    @Test
    void shouldCloseEverythingOnShutdown() {
        pipeline.authorization.grant("alice", TestEvents.TENANT, Set.of("p-1"));
        FakeClientConnection attached = pipeline.connect("c1", "alice", null);
        FakeClientConnection pending = new FakeClientConnection("c2");
        pipeline.sessionManager.opened(pending);

        pipeline.sessionManager.closeAll(DisconnectReason.SHUTDOWN);

        assertEquals(DisconnectReason.SHUTDOWN, attached.closedWith());
        assertEquals(DisconnectReason.SHUTDOWN, pending.closedWith());
        assertEquals(0, pipeline.channels.size());
    }

    @Test
    void shouldComputeStartCursor() {
        assertEquals(7L, SessionManager.startCursor(null, 7L));
        assertEquals(7L, SessionManager.startCursor(9L, 7L));
        assertEquals(3L, SessionManager.startCursor(3L, 7L));
        assertEquals(0L, SessionManager.startCursor(-5L, 7L));
    }

    @Test
    void shouldNotCallVerifierForUnknownConnection() {
        when(pipeline.tokenVerifier.verify(anyString())).thenThrow(new AssertionError("not expected"));

        assertDoesNotThrow(() -> pipeline.sessionManager.handshake("ghost", "token", null));
    }
}
