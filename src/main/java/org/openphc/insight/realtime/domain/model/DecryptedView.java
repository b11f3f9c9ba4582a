package org.openphc.insight.realtime.domain.model;

import java.util.Map;
import java.util.Set;

/**
 * The payload as one subscriber may see it: entitled fields in plaintext, plus the names of
 * entitled fields that could not be decrypted.
 */
public record DecryptedView(Map<String, String> fields, Set<String> withheld) {

    public DecryptedView {
        fields = Map.copyOf(fields);
        withheld = Set.copyOf(withheld);
    }
}
