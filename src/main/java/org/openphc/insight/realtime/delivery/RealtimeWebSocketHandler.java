package org.openphc.insight.realtime.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.dto.ClientMessage;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Client stream endpoint. Expects {@code connect} as the first frame, then {@code ack}s.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

    private final SessionManager sessionManager;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        MDC.put("connectionId", session.getId());
        try {
            sessionManager.opened(new WebSocketClientConnection(session, objectMapper));
        } finally {
            MDC.clear();
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        MDC.put("connectionId", session.getId());
        try {
            ClientMessage frame;
            try {
                frame = objectMapper.readValue(message.getPayload(), ClientMessage.class);
            } catch (JsonProcessingException e) {
                sessionManager.protocolError(session.getId(), "unreadable frame");
                return;
            }
            if (frame.getType() == null) {
                sessionManager.protocolError(session.getId(), "missing or unknown frame type");
                return;
            }
            switch (frame.getType()) {
                case CONNECT -> sessionManager.handshake(session.getId(), frame.getToken(), frame.getLastSeenCursor());
                case ACK -> sessionManager.acknowledge(session.getId(), frame.getSequence());
                default -> sessionManager.protocolError(session.getId(), "unexpected frame type " + frame.getType());
            }
        } finally {
            MDC.clear();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.info("Transport error on {}: {}", session.getId(), exception.getMessage());
        sessionManager.closed(session.getId(), DisconnectReason.TRANSPORT_ERROR);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionManager.closed(session.getId(), DisconnectReason.CLIENT_CLOSED);
    }
}
