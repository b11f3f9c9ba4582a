package org.openphc.insight.realtime.delivery;

import org.openphc.insight.realtime.api.dto.ServerMessage;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;

/**
 * Callbacks from a {@link ConnectionChannel}. Never invoked while the channel holds its lock.
 */
public interface ChannelListener {

    /** A paused channel emptied its queue and can resume from the backlog. */
    void onDrainedWhilePaused(ConnectionChannel channel);

    void onClosed(ConnectionChannel channel, DisconnectReason reason);

    default void onSent(ConnectionChannel channel, ServerMessage message) {
    }
}
