package org.openphc.insight.realtime.domain.repository;

import org.openphc.insight.realtime.domain.model.ChangeLogRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChangeLogRecordRepository extends JpaRepository<ChangeLogRecord, Long> {

    List<ChangeLogRecord> findByIdGreaterThanOrderByIdAsc(Long id, Pageable pageable);
}
