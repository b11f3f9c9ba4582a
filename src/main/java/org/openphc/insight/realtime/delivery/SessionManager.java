package org.openphc.insight.realtime.delivery;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.dto.ServerMessage;
import org.openphc.insight.realtime.api.exception.AuthorizationStaleException;
import org.openphc.insight.realtime.api.exception.ConnectionRejectedException;
import org.openphc.insight.realtime.api.exception.UnknownSubscriberException;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.domain.model.Subscriber;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;
import org.openphc.insight.realtime.domain.model.enums.FieldClassification;
import org.openphc.insight.realtime.routing.DeliverySequencer;
import org.openphc.insight.realtime.routing.ReplayService;
import org.openphc.insight.realtime.subscription.AuthorizationSource;
import org.openphc.insight.realtime.subscription.SubscriptionRegistry;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Connection lifecycle: handshake, attach, acknowledgements and teardown.
 * <p>
 * A connection is pending until its {@code connect} frame has been verified. The handshake
 * loads authorization, registers the subscriber through the sequencer and then either replays
 * from the client's cursor or tells it to resync.
 */
@Component
@Slf4j
public class SessionManager implements ChannelListener {

    private final TokenVerifier tokenVerifier;
    private final AuthorizationSource authorizationSource;
    private final SubscriptionRegistry registry;
    private final DeliverySequencer sequencer;
    private final ReplayService replayService;
    private final ChannelDirectory channels;
    private final Executor deliveryExecutor;
    private final Clock clock;
    private final RealtimeProperties.Delivery settings;
    private final MeterRegistry meterRegistry;

    private final Map<String, PendingConnection> pending = new ConcurrentHashMap<>();

    public SessionManager(TokenVerifier tokenVerifier,
                          AuthorizationSource authorizationSource,
                          SubscriptionRegistry registry,
                          DeliverySequencer sequencer,
                          ReplayService replayService,
                          ChannelDirectory channels,
                          @Qualifier("deliveryExecutor") Executor deliveryExecutor,
                          Clock clock,
                          RealtimeProperties properties,
                          MeterRegistry meterRegistry) {
        this.tokenVerifier = tokenVerifier;
        this.authorizationSource = authorizationSource;
        this.registry = registry;
        this.sequencer = sequencer;
        this.replayService = replayService;
        this.channels = channels;
        this.deliveryExecutor = deliveryExecutor;
        this.clock = clock;
        this.settings = properties.getDelivery();
        this.meterRegistry = meterRegistry;
    }

    public void opened(ClientConnection connection) {
        pending.put(connection.id(), new PendingConnection(connection, clock.instant()));
        log.debug("Connection {} opened, awaiting handshake", connection.id());
    }

    /**
     * Completes the handshake for a pending connection.
     *
     * @param lastSeenCursor highest sequence the client already has, or null for a fresh start
     */
    public void handshake(String connectionId, String token, Long lastSeenCursor) {
        PendingConnection pendingConnection = pending.remove(connectionId);
        if (pendingConnection == null) {
            ConnectionChannel existing = channels.get(connectionId);
            if (existing != null) {
                log.warn("Duplicate connect frame on {}", connectionId);
                existing.close(DisconnectReason.PROTOCOL_ERROR);
            }
            return;
        }
        ClientConnection connection = pendingConnection.connection();
        try {
            AuthenticatedPrincipal principal = tokenVerifier.verify(token);
            MDC.put("userId", principal.userId());
            Set<String> patients;
            Set<FieldClassification> entitlements;
            try {
                patients = authorizationSource.authorizedPatients(principal.userId(), principal.tenantId());
                entitlements = authorizationSource.entitlements(principal.userId());
            } catch (AuthorizationStaleException e) {
                throw new ConnectionRejectedException("Authorization unavailable",
                        DisconnectReason.AUTHORIZATION_UNAVAILABLE, e);
            }
            if (settings.isExclusiveSessions()) {
                closeOtherSessions(principal.userId(), connectionId);
            }
            attach(connection, principal, patients, entitlements, lastSeenCursor);
        } catch (ConnectionRejectedException e) {
            log.warn("Rejected connection {}: {}", connectionId, e.getMessage());
            sendQuietly(connection, ServerMessage.error(e.getReason().getDescription()));
            connection.close(e.getReason());
            countDisconnect(e.getReason());
        }
    }

    private void attach(ClientConnection connection, AuthenticatedPrincipal principal, Set<String> patients,
                        Set<FieldClassification> entitlements, Long lastSeenCursor) {
        DeliverySequencer.Attachment attachment = sequencer.attach(liveFrom -> {
            long start = startCursor(lastSeenCursor, liveFrom - 1);
            Subscriber subscriber = registry.register(connection.id(), principal.userId(), principal.tenantId(),
                    patients, entitlements, start);
            return new ConnectionChannel(subscriber, connection, start, settings.getQueueCapacity(),
                    deliveryExecutor, this, clock);
        });
        ConnectionChannel channel = attachment.channel();
        long head = attachment.liveFrom() - 1;
        log.info("Connection {} attached (cursor={}, head={}, patients={})",
                connection.id(), lastSeenCursor, head, patients.size());
        if (lastSeenCursor != null && lastSeenCursor > head) {
            channel.finishReplay(head, "cursor ahead of stream");
        } else {
            replayService.scheduleReplay(channel, startCursor(lastSeenCursor, head), head);
        }
    }

    /**
     * Where delivery starts for a client: its own cursor, or the current head when it has none
     * or claims one the stream has not reached.
     */
    static long startCursor(Long lastSeenCursor, long head) {
        if (lastSeenCursor == null || lastSeenCursor > head) {
            return head;
        }
        return Math.max(0L, lastSeenCursor);
    }

    public void acknowledge(String connectionId, Long sequence) {
        ConnectionChannel channel = channels.get(connectionId);
        if (channel == null) {
            protocolError(connectionId, "ack before connect");
            return;
        }
        if (sequence == null) {
            channel.touch();
            return;
        }
        channel.acknowledge(sequence);
    }

    public void protocolError(String connectionId, String detail) {
        log.warn("Protocol error on {}: {}", connectionId, detail);
        PendingConnection pendingConnection = pending.remove(connectionId);
        if (pendingConnection != null) {
            sendQuietly(pendingConnection.connection(), ServerMessage.error(detail));
            pendingConnection.connection().close(DisconnectReason.PROTOCOL_ERROR);
            countDisconnect(DisconnectReason.PROTOCOL_ERROR);
            return;
        }
        ConnectionChannel channel = channels.get(connectionId);
        if (channel != null) {
            channel.close(DisconnectReason.PROTOCOL_ERROR);
        }
    }

    /** The transport is gone; release everything held for the connection. */
    public void closed(String connectionId, DisconnectReason reason) {
        if (pending.remove(connectionId) != null) {
            log.debug("Pending connection {} closed before handshake", connectionId);
            return;
        }
        ConnectionChannel channel = channels.get(connectionId);
        if (channel != null) {
            channel.close(reason);
        }
    }

    public void disconnect(String connectionId, DisconnectReason reason) {
        ConnectionChannel channel = channels.get(connectionId);
        if (channel == null) {
            throw new UnknownSubscriberException(connectionId);
        }
        channel.close(reason);
    }

    public int expireHandshakes(Instant now) {
        Duration timeout = settings.getHandshakeTimeout();
        int expired = 0;
        for (Map.Entry<String, PendingConnection> e : pending.entrySet()) {
            if (e.getValue().openedAt().plus(timeout).isBefore(now) && pending.remove(e.getKey(), e.getValue())) {
                log.info("Connection {} did not complete handshake within {}", e.getKey(), timeout);
                e.getValue().connection().close(DisconnectReason.HANDSHAKE_TIMEOUT);
                countDisconnect(DisconnectReason.HANDSHAKE_TIMEOUT);
                expired++;
            }
        }
        return expired;
    }

    public void closeAll(DisconnectReason reason) {
        pending.values().forEach(p -> p.connection().close(reason));
        pending.clear();
        channels.all().forEach(channel -> channel.close(reason));
        log.info("Closed all connections ({})", reason);
    }

    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void onDrainedWhilePaused(ConnectionChannel channel) {
        sequencer.resume(channel).ifPresent(range ->
                replayService.scheduleReplay(channel, range.fromExclusive(), range.throughInclusive()));
    }

    @Override
    public void onClosed(ConnectionChannel channel, DisconnectReason reason) {
        channels.remove(channel);
        registry.deregister(channel.connectionId());
        countDisconnect(reason);
        log.info("Connection {} closed: {} (cursor={})", channel.connectionId(), reason.getDescription(),
                channel.getSubscriber().cursor());
    }

    @Override
    public void onSent(ConnectionChannel channel, ServerMessage message) {
        meterRegistry.counter("insight.delivery.messages", "type", message.getType().wireName()).increment();
    }

    private void closeOtherSessions(String userId, String connectionId) {
        for (Subscriber other : registry.subscribersOfUser(userId)) {
            if (other.getConnectionId().equals(connectionId)) {
                continue;
            }
            ConnectionChannel channel = channels.get(other.getConnectionId());
            if (channel != null) {
                log.info("Closing connection {} of user {}: superseded by {}",
                        other.getConnectionId(), userId, connectionId);
                channel.close(DisconnectReason.SUPERSEDED);
            }
        }
    }

    private void countDisconnect(DisconnectReason reason) {
        meterRegistry.counter("insight.delivery.disconnects", "reason", reason.name().toLowerCase(Locale.ROOT)).increment();
    }

    private static void sendQuietly(ClientConnection connection, ServerMessage message) {
        try {
            connection.send(message);
        } catch (IOException e) {
            log.debug("Could not send {} to {}: {}", message.getType(), connection.id(), e.getMessage());
        }
    }

    private record PendingConnection(ClientConnection connection, Instant openedAt) {
    }
}
