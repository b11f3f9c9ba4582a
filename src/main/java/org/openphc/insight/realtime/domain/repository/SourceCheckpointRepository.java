package org.openphc.insight.realtime.domain.repository;

import org.openphc.insight.realtime.domain.model.SourceCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SourceCheckpointRepository extends JpaRepository<SourceCheckpoint, String> {
}
