package org.openphc.insight.realtime.support;

import org.openphc.insight.realtime.api.exception.AuthorizationStaleException;
import org.openphc.insight.realtime.domain.model.enums.FieldClassification;
import org.openphc.insight.realtime.subscription.AuthorizationSource;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

public class FakeAuthorizationSource implements AuthorizationSource {

    private final Map<String, Set<String>> patients = new HashMap<>();
    private final Map<String, Set<FieldClassification>> entitlements = new HashMap<>();
    private volatile boolean unavailable;

    public FakeAuthorizationSource grant(String userId, String tenantId, Set<String> patientIds,
                                         FieldClassification... classifications) {
        patients.put(userId + "@" + tenantId, Set.copyOf(patientIds));
        entitlements.put(userId, classifications.length == 0
                ? EnumSet.of(FieldClassification.METADATA)
                : EnumSet.of(classifications[0], classifications));
        return this;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    @Override
    public synchronized Set<String> authorizedPatients(String userId, String tenantId) {
        if (unavailable) {
            throw new AuthorizationStaleException("assignments store down", null);
        }
        return patients.getOrDefault(userId + "@" + tenantId, Set.of());
    }

    @Override
    public synchronized Set<FieldClassification> entitlements(String userId) {
        if (unavailable) {
            throw new AuthorizationStaleException("entitlements store down", null);
        }
        return entitlements.getOrDefault(userId, EnumSet.of(FieldClassification.METADATA));
    }
}
