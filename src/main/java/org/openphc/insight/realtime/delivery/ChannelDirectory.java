package org.openphc.insight.realtime.delivery;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live connection channels by connection id.
 */
@Component
public class ChannelDirectory {

    private final Map<String, ConnectionChannel> channels = new ConcurrentHashMap<>();

    public void register(ConnectionChannel channel) {
        ConnectionChannel previous = channels.putIfAbsent(channel.connectionId(), channel);
        if (previous != null) {
            throw new IllegalStateException("Channel already registered: " + channel.connectionId());
        }
    }

    public ConnectionChannel get(String connectionId) {
        return channels.get(connectionId);
    }

    public boolean remove(ConnectionChannel channel) {
        return channels.remove(channel.connectionId(), channel);
    }

    public Collection<ConnectionChannel> all() {
        return channels.values();
    }

    public Map<String, ConnectionChannel> snapshot() {
        return Map.copyOf(channels);
    }

    public int size() {
        return channels.size();
    }
}
