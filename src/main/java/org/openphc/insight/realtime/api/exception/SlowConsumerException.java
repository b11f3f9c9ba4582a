package org.openphc.insight.realtime.api.exception;

import lombok.Getter;

/**
 * A connection kept its queue full past the slow-consumer timeout.
 */
@Getter
public class SlowConsumerException extends RuntimeException {

    private final String connectionId;

    public SlowConsumerException(String connectionId, long pausedMillis) {
        super("Connection " + connectionId + " stayed backpressured for " + pausedMillis + " ms");
        this.connectionId = connectionId;
    }
}
