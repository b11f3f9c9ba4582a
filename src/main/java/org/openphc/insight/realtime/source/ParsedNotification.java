package org.openphc.insight.realtime.source;

import lombok.Builder;
import lombok.Value;
import org.openphc.insight.realtime.domain.model.ChangeEvent;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * A validated notification, waiting for its sequence number.
 */
@Value
@Builder
public class ParsedNotification {

    String changeId;
    String entityKind;
    String entityId;
    String tenantId;
    String patientId;
    OffsetDateTime occurredAt;
    Map<String, String> payload;
    boolean payloadEncrypted;
    String keyReference;

    public ChangeEvent toChangeEvent(long sequence) {
        return ChangeEvent.builder()
                .sequence(sequence)
                .changeId(changeId)
                .entityKind(entityKind)
                .entityId(entityId)
                .tenantId(tenantId)
                .patientId(patientId)
                .occurredAt(occurredAt)
                .payload(payload)
                .payloadEncrypted(payloadEncrypted)
                .keyReference(keyReference)
                .build();
    }
}
