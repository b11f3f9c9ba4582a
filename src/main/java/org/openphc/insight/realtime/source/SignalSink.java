package org.openphc.insight.realtime.source;

import org.openphc.insight.realtime.domain.model.SourceSignal;

/**
 * Receives sequenced events and gap markers from the source, in emission order.
 */
public interface SignalSink {

    void submit(SourceSignal signal) throws InterruptedException;
}
