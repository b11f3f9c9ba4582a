package org.openphc.insight.realtime.domain.repository;

import org.openphc.insight.realtime.domain.model.UserEntitlement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UserEntitlementRepository extends JpaRepository<UserEntitlement, String> {
}
