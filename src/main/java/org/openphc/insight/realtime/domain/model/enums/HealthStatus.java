package org.openphc.insight.realtime.domain.model.enums;

public enum HealthStatus {
    CONNECTED,
    RECONNECTING,
    DEGRADED,
    STOPPED
}
