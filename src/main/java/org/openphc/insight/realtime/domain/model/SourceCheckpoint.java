package org.openphc.insight.realtime.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * Per-source sequence reservation and last consumed upstream position.
 */
@Entity
@Table(name = "source_checkpoint")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SourceCheckpoint {

    @Id
    @Column(name = "source_id")
    private String sourceId;

    @Column(name = "reserved_through", nullable = false)
    private long reservedThrough;

    @Column(name = "last_position")
    private String lastPosition;

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
