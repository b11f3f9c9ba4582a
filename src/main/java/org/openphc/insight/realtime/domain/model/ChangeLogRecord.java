package org.openphc.insight.realtime.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Row of the primary database's change log, written by table triggers. Read-only here.
 */
@Entity
@Immutable
@Table(name = "change_log")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChangeLogRecord {

    @Id
    private Long id;

    @Column(name = "entity_kind", nullable = false)
    private String entityKind;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Column(name = "tenant_id")
    private String tenantId;

    @Column(name = "patient_id")
    private String patientId;

    @Column(name = "occurred_at")
    private OffsetDateTime occurredAt;

    @Column(columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> payload;

    @Column(name = "payload_is_encrypted", nullable = false)
    private boolean payloadEncrypted;

    @Column(name = "key_reference")
    private String keyReference;
}
