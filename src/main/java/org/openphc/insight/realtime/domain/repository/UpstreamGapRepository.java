package org.openphc.insight.realtime.domain.repository;

import org.openphc.insight.realtime.domain.model.UpstreamGap;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface UpstreamGapRepository extends JpaRepository<UpstreamGap, Long> {

    @Query("select max(g.lastSequence) from UpstreamGap g where g.lastSequence > :fromExclusive"
            + " and g.lastSequence <= :throughInclusive")
    Long findLatestWithin(@Param("fromExclusive") long fromExclusive,
                          @Param("throughInclusive") long throughInclusive);
}
