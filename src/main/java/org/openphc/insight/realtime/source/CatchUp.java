package org.openphc.insight.realtime.source;

import java.util.List;

/**
 * Notifications missed while disconnected. When {@code recoverable} is false the channel could
 * not reconstruct the full range and subscribers must resync.
 */
public record CatchUp(List<RawNotification> notifications, boolean recoverable, String reason) {

    public static CatchUp complete(List<RawNotification> notifications) {
        return new CatchUp(List.copyOf(notifications), true, null);
    }

    public static CatchUp incomplete(String reason) {
        return new CatchUp(List.of(), false, reason);
    }
}
