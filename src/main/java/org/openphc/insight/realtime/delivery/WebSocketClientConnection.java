package org.openphc.insight.realtime.delivery;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.dto.ServerMessage;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link ClientConnection} over a Spring WebSocket session, JSON-encoded.
 */
@Slf4j
public class WebSocketClientConnection implements ClientConnection {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketClientConnection(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(ServerMessage message) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Session " + session.getId() + " is closed");
        }
        TextMessage frame = new TextMessage(objectMapper.writeValueAsString(message));
        synchronized (session) {
            session.sendMessage(frame);
        }
    }

    @Override
    public void close(DisconnectReason reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(reason.getCloseCode(), reason.getDescription()));
        } catch (IOException e) {
            log.debug("Closing session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
