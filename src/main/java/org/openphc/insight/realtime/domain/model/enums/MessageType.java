package org.openphc.insight.realtime.domain.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Message types on the client stream, in both directions.
 */
public enum MessageType {
    CONNECT,
    ACK,
    EVENT,
    RESYNC_REQUIRED,
    REPLAY_COMPLETE,
    HEARTBEAT,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (MessageType type : values()) {
            if (type.wireName().equals(value)) {
                return type;
            }
        }
        return null;
    }
}
