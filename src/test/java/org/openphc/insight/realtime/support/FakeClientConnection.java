package org.openphc.insight.realtime.support;

import org.openphc.insight.realtime.api.dto.ServerMessage;
import org.openphc.insight.realtime.delivery.ClientConnection;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;
import org.openphc.insight.realtime.domain.model.enums.MessageType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Records every frame sent and the close reason.
 */
public class FakeClientConnection implements ClientConnection {

    private final String id;
    private final List<ServerMessage> sent = new ArrayList<>();
    private DisconnectReason closedWith;
    private boolean failSends;

    public FakeClientConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public synchronized void send(ServerMessage message) throws IOException {
        if (failSends) {
            throw new IOException("connection reset");
        }
        sent.add(message);
    }

    @Override
    public synchronized void close(DisconnectReason reason) {
        if (closedWith == null) {
            closedWith = reason;
        }
    }

    public synchronized void failSends() {
        this.failSends = true;
    }

    public synchronized List<ServerMessage> sent() {
        return List.copyOf(sent);
    }

    public synchronized List<ServerMessage> sent(MessageType type) {
        return sent.stream().filter(m -> m.getType() == type).toList();
    }

    /** Sequences of the {@code event} frames, in send order. */
    public synchronized List<Long> eventSequences() {
        return sent.stream()
                .filter(m -> m.getType() == MessageType.EVENT)
                .map(ServerMessage::getSequence)
                .toList();
    }

    public synchronized DisconnectReason closedWith() {
        return closedWith;
    }

    public synchronized boolean isClosed() {
        return closedWith != null;
    }
}
