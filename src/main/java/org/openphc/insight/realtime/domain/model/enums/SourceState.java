package org.openphc.insight.realtime.domain.model.enums;

public enum SourceState {
    CONNECTED,
    RECONNECTING,
    STOPPED
}
