package org.openphc.insight.realtime.source;

/**
 * A notification as it came off the upstream channel.
 *
 * @param position opaque upstream position, used for catch-up after a reconnect
 * @param body     JSON text, may be null or garbage
 */
public record RawNotification(String position, String body) {
}
