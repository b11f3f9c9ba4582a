package org.openphc.insight.realtime.api.exception;

import lombok.Getter;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;

/**
 * The handshake could not be completed: bad token, missing claims or unavailable authorization.
 */
@Getter
public class ConnectionRejectedException extends RuntimeException {

    private final DisconnectReason reason;

    public ConnectionRejectedException(String message, DisconnectReason reason) {
        super(message);
        this.reason = reason;
    }

    public ConnectionRejectedException(String message, DisconnectReason reason, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
