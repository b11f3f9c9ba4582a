package org.openphc.insight.realtime.domain.model.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Sensitivity class of a payload field. Subscribers hold one entitlement per class.
 */
public enum FieldClassification {
    CLINICAL_NOTES,
    TRANSCRIPT,
    INSIGHTS,
    DEMOGRAPHICS,
    METADATA;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<FieldClassification> fromName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (FieldClassification c : values()) {
            if (c.name().equals(normalized)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
