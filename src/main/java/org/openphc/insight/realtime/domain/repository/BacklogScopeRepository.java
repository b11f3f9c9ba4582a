package org.openphc.insight.realtime.domain.repository;

import org.openphc.insight.realtime.domain.model.BacklogScope;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BacklogScopeRepository extends JpaRepository<BacklogScope, String> {
}
