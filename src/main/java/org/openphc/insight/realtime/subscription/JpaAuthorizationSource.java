package org.openphc.insight.realtime.subscription;

import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.exception.AuthorizationStaleException;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.domain.model.PatientAssignment;
import org.openphc.insight.realtime.domain.model.enums.FieldClassification;
import org.openphc.insight.realtime.domain.repository.PatientAssignmentRepository;
import org.openphc.insight.realtime.domain.repository.UserEntitlementRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads {@code patient_assignment} and {@code user_entitlement}.
 */
@Component
@Slf4j
public class JpaAuthorizationSource implements AuthorizationSource {

    private final PatientAssignmentRepository assignmentRepository;
    private final UserEntitlementRepository entitlementRepository;
    private final Set<FieldClassification> defaultEntitlements;

    public JpaAuthorizationSource(PatientAssignmentRepository assignmentRepository,
                                  UserEntitlementRepository entitlementRepository,
                                  RealtimeProperties properties) {
        this.assignmentRepository = assignmentRepository;
        this.entitlementRepository = entitlementRepository;
        this.defaultEntitlements = Set.copyOf(properties.getAuthorization().getDefaultEntitlements());
    }

    @Override
    public Set<String> authorizedPatients(String userId, String tenantId) {
        try {
            return assignmentRepository.findByUserIdAndTenantIdAndActiveTrue(userId, tenantId).stream()
                    .map(PatientAssignment::getPatientId)
                    .collect(Collectors.toUnmodifiableSet());
        } catch (DataAccessException e) {
            throw new AuthorizationStaleException("Patient assignments unavailable for user " + userId, e);
        }
    }

    @Override
    public Set<FieldClassification> entitlements(String userId) {
        try {
            return entitlementRepository.findById(userId)
                    .map(row -> {
                        Set<FieldClassification> granted = EnumSet.noneOf(FieldClassification.class);
                        for (String capability : row.getCapabilities()) {
                            Optional<FieldClassification> c = FieldClassification.fromName(capability);
                            if (c.isPresent()) {
                                granted.add(c.get());
                            } else {
                                log.warn("Ignoring unknown capability '{}' for user {}", capability, userId);
                            }
                        }
                        return (Set<FieldClassification>) granted;
                    })
                    .orElse(defaultEntitlements);
        } catch (DataAccessException e) {
            throw new AuthorizationStaleException("Entitlements unavailable for user " + userId, e);
        }
    }
}
