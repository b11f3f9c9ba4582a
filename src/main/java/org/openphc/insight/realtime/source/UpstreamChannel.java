package org.openphc.insight.realtime.source;

import org.openphc.insight.realtime.api.exception.TransientUpstreamException;

import java.time.Duration;
import java.util.List;

/**
 * Connection to the external change-notification stream. Used from a single thread.
 * Every method may raise {@link TransientUpstreamException}.
 */
public interface UpstreamChannel extends AutoCloseable {

    String name();

    void connect();

    boolean isConnected();

    /** Blocks up to {@code timeout} for notifications; an empty list means none arrived. */
    List<RawNotification> poll(Duration timeout);

    /** Confirms everything returned by earlier polls has been handed off. */
    default void commit() {
    }

    /**
     * Notifications after {@code position}, at most {@code limit}. A null position means nothing
     * was consumed yet.
     */
    CatchUp fetchSince(String position, int limit);

    @Override
    void close();
}
