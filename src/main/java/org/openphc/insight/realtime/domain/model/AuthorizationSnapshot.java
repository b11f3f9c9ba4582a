package org.openphc.insight.realtime.domain.model;

import org.openphc.insight.realtime.domain.model.enums.FieldClassification;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Point-in-time view of what a subscriber may see. Replaced as a whole on refresh.
 */
public record AuthorizationSnapshot(Set<String> authorizedPatientIds,
                                    Set<FieldClassification> entitlements,
                                    Instant fetchedAt) {

    public AuthorizationSnapshot {
        authorizedPatientIds = Set.copyOf(authorizedPatientIds);
        entitlements = entitlements.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(entitlements));
    }

    public boolean permits(String patientId) {
        return authorizedPatientIds.contains(patientId);
    }

    public boolean isEntitledTo(FieldClassification classification) {
        return entitlements.contains(classification);
    }

    public AuthorizationSnapshot withPatients(Set<String> patientIds, Instant at) {
        return new AuthorizationSnapshot(patientIds, entitlements, at);
    }
}
