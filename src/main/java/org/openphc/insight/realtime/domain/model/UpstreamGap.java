package org.openphc.insight.realtime.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * Upstream changes after {@code lastSequence} were lost and cannot be replayed.
 */
@Entity
@Table(name = "upstream_gap")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UpstreamGap {

    @Id
    @Column(name = "last_sequence")
    private Long lastSequence;

    @Column(name = "reason", length = 512)
    private String reason;

    @Column(name = "detected_at", nullable = false)
    private OffsetDateTime detectedAt;
}
