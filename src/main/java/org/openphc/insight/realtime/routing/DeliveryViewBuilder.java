package org.openphc.insight.realtime.routing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.exception.EncryptionException;
import org.openphc.insight.realtime.crypto.EncryptionGate;
import org.openphc.insight.realtime.crypto.FieldClassifier;
import org.openphc.insight.realtime.domain.model.ChangeEvent;
import org.openphc.insight.realtime.domain.model.DecryptedView;
import org.openphc.insight.realtime.domain.model.enums.FieldClassification;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds a subscriber's view of an event. Fields outside the entitlements are left out
 * entirely; entitled protected fields are decrypted, or withheld by name when that fails.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeliveryViewBuilder {

    private final FieldClassifier fieldClassifier;
    private final EncryptionGate encryptionGate;

    public DecryptedView build(ChangeEvent event, Set<FieldClassification> entitlements) {
        Map<String, String> fields = new LinkedHashMap<>();
        Set<String> withheld = new TreeSet<>();
        for (Map.Entry<String, String> field : event.getPayload().entrySet()) {
            FieldClassification classification = fieldClassifier.classify(field.getKey());
            if (!entitlements.contains(classification)) {
                continue;
            }
            if (!event.isPayloadEncrypted() || classification == FieldClassification.METADATA) {
                fields.put(field.getKey(), field.getValue());
                continue;
            }
            try {
                fields.put(field.getKey(),
                        encryptionGate.decrypt(field.getValue(), classification, event.getKeyReference()));
            } catch (EncryptionException e) {
                withheld.add(field.getKey());
                log.warn("Withholding field '{}' of {} #{}: {}", field.getKey(), event.getEntityKind(),
                        event.getSequence(), e.getMessage());
            }
        }
        return new DecryptedView(fields, withheld);
    }
}
