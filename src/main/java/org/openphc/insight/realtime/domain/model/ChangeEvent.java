package org.openphc.insight.realtime.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * A single upstream row change, stamped with its position in the global stream.
 * Protected fields in {@link #payload} stay ciphertext when {@link #payloadEncrypted} is set.
 */
@Value
@Builder(toBuilder = true)
public class ChangeEvent implements SourceSignal {

    long sequence;
    String changeId;
    String entityKind;
    String entityId;
    String tenantId;
    String patientId;
    OffsetDateTime occurredAt;

    @Singular("payloadField")
    Map<String, String> payload;

    boolean payloadEncrypted;
    String keyReference;

    public ScopeKey scopeKey() {
        return new ScopeKey(tenantId, patientId);
    }
}
