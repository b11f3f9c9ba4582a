package org.openphc.insight.realtime.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Emitted after an upstream reconnect. Events up to {@link #lastSequence} were assigned
 * before the connection dropped; anything after it is catch-up or live traffic.
 */
@Value
@Builder
public class GapMarker implements SourceSignal {

    long lastSequence;
    String upstreamPosition;
    boolean recoverable;
    String reason;
    OffsetDateTime detectedAt;
}
