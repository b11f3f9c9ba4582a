package org.openphc.insight.realtime.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Retained copy of a routed event, keyed by scope and global sequence.
 * Payload is stored exactly as received, protected fields still encrypted.
 */
@Entity
@Table(name = "backlog_entry",
        uniqueConstraints = @UniqueConstraint(name = "uk_backlog_scope_sequence",
                columnNames = {"scope_key", "sequence"}),
        indexes = {
                @Index(name = "idx_backlog_change_id", columnList = "change_id"),
                @Index(name = "idx_backlog_appended_at", columnList = "appended_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacklogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "scope_key", nullable = false)
    private String scopeKey;

    @Column(nullable = false)
    private long sequence;

    @Column(name = "change_id")
    private String changeId;

    @Column(name = "entity_kind", nullable = false)
    private String entityKind;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "patient_id", nullable = false)
    private String patientId;

    @Column(name = "occurred_at", nullable = false)
    private OffsetDateTime occurredAt;

    @Column(columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, String> payload;

    @Column(name = "payload_encrypted", nullable = false)
    private boolean payloadEncrypted;

    @Column(name = "key_reference")
    private String keyReference;

    @Column(name = "appended_at", nullable = false)
    @Builder.Default
    private OffsetDateTime appendedAt = OffsetDateTime.now();

    public static BacklogEntry from(ScopeKey scope, ChangeEvent event, OffsetDateTime appendedAt) {
        return BacklogEntry.builder()
                .scopeKey(scope.asString())
                .sequence(event.getSequence())
                .changeId(event.getChangeId())
                .entityKind(event.getEntityKind())
                .entityId(event.getEntityId())
                .tenantId(event.getTenantId())
                .patientId(event.getPatientId())
                .occurredAt(event.getOccurredAt())
                .payload(event.getPayload())
                .payloadEncrypted(event.isPayloadEncrypted())
                .keyReference(event.getKeyReference())
                .appendedAt(appendedAt)
                .build();
    }

    public ChangeEvent toChangeEvent() {
        return ChangeEvent.builder()
                .sequence(sequence)
                .changeId(changeId)
                .entityKind(entityKind)
                .entityId(entityId)
                .tenantId(tenantId)
                .patientId(patientId)
                .occurredAt(occurredAt)
                .payload(payload == null ? Map.of() : payload)
                .payloadEncrypted(payloadEncrypted)
                .keyReference(keyReference)
                .build();
    }
}
