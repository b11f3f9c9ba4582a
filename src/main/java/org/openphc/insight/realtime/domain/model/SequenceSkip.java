package org.openphc.insight.realtime.domain.model;

import lombok.Value;

/**
 * Sequence that was assigned but never handed off. The sequencer moves past it so later
 * events are not held back.
 */
@Value
public class SequenceSkip implements SourceSignal {

    long sequence;
    String reason;
}
