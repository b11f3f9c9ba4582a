package org.openphc.insight.realtime.routing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.crypto.ConfiguredKeyService;
import org.openphc.insight.realtime.crypto.EncryptionGate;
import org.openphc.insight.realtime.crypto.FieldClassifier;
import org.openphc.insight.realtime.domain.model.ChangeEvent;
import org.openphc.insight.realtime.domain.model.DecryptedView;
import org.openphc.insight.realtime.domain.model.enums.FieldClassification;

import java.util.Base64;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.openphc.insight.realtime.domain.model.enums.FieldClassification.*;

class DeliveryViewBuilderTest {

    private EncryptionGate gate;
    private DeliveryViewBuilder builder;

    @BeforeEach
    void setUp() {
        RealtimeProperties properties = new RealtimeProperties();
        properties.getCrypto().getKeys().put("k1", Base64.getEncoder().encodeToString(new byte[32]));
        gate = new EncryptionGate(new ConfiguredKeyService(properties));
        builder = new DeliveryViewBuilder(new FieldClassifier(properties), gate);
    }

    private ChangeEvent encryptedReport() {
        return ChangeEvent.builder()
                .sequence(7)
                .entityKind("session_reports")
                .entityId("r-7")
                .tenantId("t-1")
                .patientId("p-1")
                .payloadField("status", "final")
                .payloadField("notes_text", gate.encrypt("Patient reports less pain", CLINICAL_NOTES, "k1"))
                .payloadField("transcript", gate.encrypt("Doctor: how are you?", TRANSCRIPT, "k1"))
                .payloadEncrypted(true)
                .keyReference("k1")
                .build();
    }

    @Test
    void shouldOmitFieldsOutsideEntitlements() {
        DecryptedView view = builder.build(encryptedReport(), EnumSet.of(METADATA));

        assertEquals(Map.of("status", "final"), view.fields());
        assertTrue(view.withheld().isEmpty());
    }

    @Test
    void shouldDecryptEntitledProtectedFields() {
        DecryptedView view = builder.build(encryptedReport(), EnumSet.of(METADATA, CLINICAL_NOTES));

        assertEquals("Patient reports less pain", view.fields().get("notes_text"));
        assertFalse(view.fields().containsKey("transcript"));
    }

    @Test
    void shouldWithholdFieldsThatFailToDecrypt() {
        ChangeEvent event = encryptedReport().toBuilder()
                .payloadField("insights", "bm90IHJlYWxseSBjaXBoZXJ0ZXh0IGF0IGFsbA==")
                .build();

        DecryptedView view = builder.build(event, EnumSet.allOf(FieldClassification.class));

        assertEquals(Set.of("insights"), view.withheld());
        assertFalse(view.fields().containsKey("insights"));
        assertEquals("Doctor: how are you?", view.fields().get("transcript"));
    }

    @Test
    void shouldPassPlaintextPayloadThrough() {
        ChangeEvent event = ChangeEvent.builder()
                .sequence(3)
                .entityKind("appointments")
                .entityId("a-1")
                .tenantId("t-1")
                .patientId("p-1")
                .payloadField("status", "booked")
                .payloadField("first_name", "Ada")
                .build();

        DecryptedView view = builder.build(event, EnumSet.of(METADATA, DEMOGRAPHICS));

        assertEquals(Map.of("status", "booked", "first_name", "Ada"), view.fields());
    }

    @Test
    void shouldReturnEmptyViewWithoutEntitlements() {
        DecryptedView view = builder.build(encryptedReport(), Set.of());

        assertTrue(view.fields().isEmpty());
    }
}
