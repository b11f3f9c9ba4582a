package org.openphc.insight.realtime.domain.repository;

import org.openphc.insight.realtime.domain.model.PatientAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PatientAssignmentRepository extends JpaRepository<PatientAssignment, UUID> {

    List<PatientAssignment> findByUserIdAndTenantIdAndActiveTrue(String userId, String tenantId);
}
