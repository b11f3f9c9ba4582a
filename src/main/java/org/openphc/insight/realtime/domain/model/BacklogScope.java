package org.openphc.insight.realtime.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * Watermarks of one scope: every entry with {@code sequence <= evictedThrough} is gone, and
 * {@code missingThrough} is the highest sequence whose append failed.
 */
@Entity
@Table(name = "backlog_scope")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacklogScope {

    @Id
    @Column(name = "scope_key")
    private String scopeKey;

    @Column(name = "evicted_through", nullable = false)
    private long evictedThrough;

    @Column(name = "missing_through", nullable = false)
    private long missingThrough;

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
