package org.openphc.insight.realtime.domain.repository;

import org.openphc.insight.realtime.domain.model.BacklogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface BacklogEntryRepository extends JpaRepository<BacklogEntry, UUID> {

    boolean existsByScopeKeyAndSequence(String scopeKey, long sequence);

    boolean existsByChangeId(String changeId);

    List<BacklogEntry> findByScopeKeyAndSequenceGreaterThanOrderBySequenceAsc(String scopeKey, long sequence);

    long countByScopeKey(String scopeKey);

    @Query("select distinct b.scopeKey from BacklogEntry b")
    List<String> findDistinctScopeKeys();

    @Query("select b.sequence from BacklogEntry b where b.scopeKey = :scopeKey order by b.sequence asc")
    List<Long> findSequencesByScopeKey(@Param("scopeKey") String scopeKey, Pageable pageable);

    @Query("select max(b.sequence) from BacklogEntry b where b.scopeKey = :scopeKey and b.appendedAt < :cutoff")
    Long findMaxSequenceAppendedBefore(@Param("scopeKey") String scopeKey, @Param("cutoff") OffsetDateTime cutoff);

    @Modifying
    @Query("delete from BacklogEntry b where b.scopeKey = :scopeKey and b.sequence <= :through")
    int deleteThrough(@Param("scopeKey") String scopeKey, @Param("through") long through);
}
