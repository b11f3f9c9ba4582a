package org.openphc.insight.realtime.crypto;

import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.domain.model.enums.FieldClassification;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps payload field names to classifications and knows which entity kinds carry protected
 * fields. Built-in defaults cover the clinical tables; configuration adds or overrides.
 */
@Component
@Slf4j
public class FieldClassifier {

    private static final Map<String, FieldClassification> DEFAULT_FIELDS = Map.ofEntries(
            Map.entry("notes_text", FieldClassification.CLINICAL_NOTES),
            Map.entry("notes_mini_summary", FieldClassification.CLINICAL_NOTES),
            Map.entry("diarization", FieldClassification.TRANSCRIPT),
            Map.entry("transcript", FieldClassification.TRANSCRIPT),
            Map.entry("insights", FieldClassification.INSIGHTS),
            Map.entry("briefing", FieldClassification.INSIGHTS),
            Map.entry("topics", FieldClassification.INSIGHTS),
            Map.entry("questions", FieldClassification.INSIGHTS),
            Map.entry("first_name", FieldClassification.DEMOGRAPHICS),
            Map.entry("last_name", FieldClassification.DEMOGRAPHICS),
            Map.entry("birth_date", FieldClassification.DEMOGRAPHICS),
            Map.entry("gender", FieldClassification.DEMOGRAPHICS),
            Map.entry("email", FieldClassification.DEMOGRAPHICS),
            Map.entry("phone_number", FieldClassification.DEMOGRAPHICS),
            Map.entry("pre_existing_history", FieldClassification.DEMOGRAPHICS));

    private static final Set<String> DEFAULT_PROTECTED_KINDS = Set.of(
            "session_reports", "patients", "patient_topics", "patient_question_suggestions",
            "patient_briefings", "patient_attendance");

    private final Map<String, FieldClassification> fields;
    private final Set<String> protectedKinds;

    public FieldClassifier(RealtimeProperties properties) {
        RealtimeProperties.Crypto crypto = properties.getCrypto();
        this.fields = new HashMap<>(DEFAULT_FIELDS);
        crypto.getFieldClassifications().forEach((name, c) -> fields.put(normalize(name), c));
        this.protectedKinds = new HashSet<>(DEFAULT_PROTECTED_KINDS);
        crypto.getProtectedEntityKinds().forEach(kind -> protectedKinds.add(normalize(kind)));
        log.info("Field classifier: {} classified field(s), protected kinds {}", fields.size(), protectedKinds);
    }

    public FieldClassification classify(String fieldName) {
        if (fieldName == null) {
            return FieldClassification.METADATA;
        }
        return fields.getOrDefault(normalize(fieldName), FieldClassification.METADATA);
    }

    public boolean isProtectedKind(String entityKind) {
        return entityKind != null && protectedKinds.contains(normalize(entityKind));
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
