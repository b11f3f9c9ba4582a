package org.openphc.insight.realtime.domain.model;

import java.util.Objects;

/**
 * Partition of the change stream: one patient within one tenant.
 * The string form {@code tenantId:patientId} is the backlog key.
 */
public record ScopeKey(String tenantId, String patientId) {

    public ScopeKey {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(patientId, "patientId");
    }

    public static ScopeKey parse(String value) {
        int idx = value.indexOf(':');
        if (idx <= 0 || idx == value.length() - 1) {
            throw new IllegalArgumentException("Invalid scope key: " + value);
        }
        return new ScopeKey(value.substring(0, idx), value.substring(idx + 1));
    }

    public String asString() {
        return tenantId + ":" + patientId;
    }

    @Override
    public String toString() {
        return asString();
    }
}
