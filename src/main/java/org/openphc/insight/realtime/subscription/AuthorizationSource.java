package org.openphc.insight.realtime.subscription;

import org.openphc.insight.realtime.domain.model.enums.FieldClassification;

import java.util.Set;

/**
 * Where patient access and field entitlements come from.
 * Implementations raise {@link org.openphc.insight.realtime.api.exception.AuthorizationStaleException}
 * when the backing store cannot be read.
 */
public interface AuthorizationSource {

    Set<String> authorizedPatients(String userId, String tenantId);

    Set<FieldClassification> entitlements(String userId);
}
