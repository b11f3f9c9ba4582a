package org.openphc.insight.realtime.domain.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why a client connection was closed, with the WebSocket close code sent to the client.
 */
@Getter
@RequiredArgsConstructor
public enum DisconnectReason {
    CLIENT_CLOSED(1000, "client closed"),
    SHUTDOWN(1001, "server shutting down"),
    TRANSPORT_ERROR(1011, "transport error"),
    AUTHORIZATION_UNAVAILABLE(1013, "authorization unavailable, retry later"),
    HANDSHAKE_TIMEOUT(4001, "handshake timeout"),
    PROTOCOL_ERROR(4002, "protocol error"),
    UNAUTHORIZED(4003, "unauthorized"),
    SLOW_CONSUMER(4008, "slow consumer"),
    ACK_TIMEOUT(4009, "acknowledgement timeout"),
    SUPERSEDED(4010, "superseded by a newer session"),
    OPERATOR(4011, "closed by operator");

    private final int closeCode;
    private final String description;
}
