package org.openphc.insight.realtime.domain.model;

/**
 * Anything the change source hands to the router: a sequenced event or a gap marker.
 */
public interface SourceSignal {
}
