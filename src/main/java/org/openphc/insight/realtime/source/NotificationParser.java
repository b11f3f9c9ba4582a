package org.openphc.insight.realtime.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.exception.MalformedEventException;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.crypto.FieldClassifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates and normalizes raw change notifications: required identifiers, entity kind,
 * occurrence time and payload shape.
 */
@Component
@Slf4j
public class NotificationParser {

    private static final int MAX_ID_LENGTH = 256;
    private static final String ENCRYPTED_PREFIX = "encrypted_";
    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^a-z0-9]+");

    private final ObjectMapper objectMapper;
    private final FieldClassifier fieldClassifier;
    private final Clock clock;
    private final String defaultKeyReference;

    public NotificationParser(ObjectMapper objectMapper, FieldClassifier fieldClassifier,
                              Clock clock, RealtimeProperties properties) {
        this.objectMapper = objectMapper;
        this.fieldClassifier = fieldClassifier;
        this.clock = clock;
        this.defaultKeyReference = properties.getSource().getDefaultKeyReference();
    }

    public ParsedNotification parse(RawNotification raw) {
        if (raw.body() == null || raw.body().isBlank()) {
            throw new MalformedEventException("Empty notification body", "body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw.body());
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Notification is not valid JSON", "body");
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEventException("Notification must be a JSON object", "body");
        }

        String entityKind = normalizeEntityKind(requiredText(root, "entity_kind"));
        String entityId = requiredText(root, "entity_id");
        String tenantId = requiredText(root, "tenant_id");
        String patientId = requiredText(root, "patient_id");
        boolean encrypted = root.path("payload_is_encrypted").asBoolean(false);
        Map<String, String> payload = payload(root.get("payload"));

        if (fieldClassifier.isProtectedKind(entityKind) && !encrypted) {
            throw new MalformedEventException(
                    "Entity kind '" + entityKind + "' is protected but payload is not encrypted",
                    "payload_is_encrypted");
        }

        String keyReference = optionalText(root, "key_reference");
        return ParsedNotification.builder()
                .changeId(optionalText(root, "change_id"))
                .entityKind(entityKind)
                .entityId(entityId)
                .tenantId(tenantId)
                .patientId(patientId)
                .occurredAt(ensureOccurredAt(optionalText(root, "occurred_at")))
                .payload(payload)
                .payloadEncrypted(encrypted)
                .keyReference(encrypted && keyReference == null ? defaultKeyReference : keyReference)
                .build();
    }

    /**
     * Lower snake case, without the storage-level {@code encrypted_} table prefix.
     * {@code "Encrypted_Session_Reports"} becomes {@code "session_reports"}.
     */
    public String normalizeEntityKind(String rawKind) {
        String kind = NON_IDENTIFIER.matcher(rawKind.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        if (kind.startsWith(ENCRYPTED_PREFIX) && kind.length() > ENCRYPTED_PREFIX.length()) {
            kind = kind.substring(ENCRYPTED_PREFIX.length());
        }
        return kind;
    }

    OffsetDateTime ensureOccurredAt(String rawTime) {
        if (rawTime != null && !rawTime.isBlank()) {
            try {
                return OffsetDateTime.parse(rawTime);
            } catch (DateTimeParseException e) {
                log.warn("Failed to parse occurred_at '{}', using server time", rawTime);
            }
        }
        return OffsetDateTime.now(clock);
    }

    private Map<String, String> payload(JsonNode node) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return fields;
        }
        if (!node.isObject()) {
            throw new MalformedEventException("payload must be a JSON object", "payload");
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            fields.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return fields;
    }

    private static String requiredText(JsonNode root, String field) {
        String value = optionalText(root, field);
        if (value == null) {
            throw new MalformedEventException("Missing required field: '" + field + "'", field);
        }
        if (value.length() > MAX_ID_LENGTH) {
            throw new MalformedEventException(
                    "'" + field + "' exceeds max length of " + MAX_ID_LENGTH + " characters", field);
        }
        return value;
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
