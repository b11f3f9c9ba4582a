package org.openphc.insight.realtime.crypto;

import org.junit.jupiter.api.Test;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.domain.model.enums.FieldClassification;

import static org.junit.jupiter.api.Assertions.*;

class FieldClassifierTest {

    @Test
    void shouldClassifyBuiltInFields() {
        FieldClassifier classifier = new FieldClassifier(new RealtimeProperties());

        assertEquals(FieldClassification.CLINICAL_NOTES, classifier.classify("notes_text"));
        assertEquals(FieldClassification.TRANSCRIPT, classifier.classify("Diarization"));
        assertEquals(FieldClassification.INSIGHTS, classifier.classify("briefing"));
        assertEquals(FieldClassification.DEMOGRAPHICS, classifier.classify("birth_date"));
    }

    @Test
    void shouldTreatUnknownFieldsAsMetadata() {
        FieldClassifier classifier = new FieldClassifier(new RealtimeProperties());

        assertEquals(FieldClassification.METADATA, classifier.classify("status"));
        assertEquals(FieldClassification.METADATA, classifier.classify(null));
    }

    @Test
    void shouldLetConfigurationOverrideAndExtend() {
        RealtimeProperties properties = new RealtimeProperties();
        properties.getCrypto().getFieldClassifications().put("gender", FieldClassification.METADATA);
        properties.getCrypto().getFieldClassifications().put("soap_note", FieldClassification.CLINICAL_NOTES);
        properties.getCrypto().getProtectedEntityKinds().add("Lab_Results");

        FieldClassifier classifier = new FieldClassifier(properties);

        assertEquals(FieldClassification.METADATA, classifier.classify("gender"));
        assertEquals(FieldClassification.CLINICAL_NOTES, classifier.classify("soap_note"));
        assertTrue(classifier.isProtectedKind("lab_results"));
        assertTrue(classifier.isProtectedKind("session_reports"));
        assertFalse(classifier.isProtectedKind("appointments"));
    }
}
