package org.openphc.insight.realtime.delivery;

import org.openphc.insight.realtime.api.dto.ServerMessage;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;

import java.io.IOException;

/**
 * Transport to one client. {@link #send} is only called from one thread at a time.
 */
public interface ClientConnection {

    String id();

    void send(ServerMessage message) throws IOException;

    /** Closes the transport. Never throws; closing twice is harmless. */
    void close(DisconnectReason reason);
}
