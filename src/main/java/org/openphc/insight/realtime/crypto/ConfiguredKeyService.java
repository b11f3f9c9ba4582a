package org.openphc.insight.realtime.crypto;

import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.exception.EncryptionException;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Keys from {@code insight.crypto.keys}: reference to Base64 256-bit AES key.
 * Invalid entries are skipped at startup and fail on use.
 */
@Component
@Slf4j
public class ConfiguredKeyService implements KeyService {

    private static final int KEY_LENGTH_BYTES = 32;

    private final Map<String, SecretKey> keys = new HashMap<>();

    public ConfiguredKeyService(RealtimeProperties properties) {
        properties.getCrypto().getKeys().forEach((reference, encoded) -> {
            try {
                byte[] material = Base64.getDecoder().decode(encoded.trim());
                if (material.length != KEY_LENGTH_BYTES) {
                    log.error("Key '{}' has {} bytes, expected {}; it will be unusable",
                            reference, material.length, KEY_LENGTH_BYTES);
                    return;
                }
                keys.put(reference, new SecretKeySpec(material, "AES"));
            } catch (IllegalArgumentException e) {
                log.error("Key '{}' is not valid Base64; it will be unusable", reference);
            }
        });
        log.info("Loaded {} data key(s)", keys.size());
    }

    @Override
    public SecretKey resolve(String keyReference) {
        if (keyReference == null) {
            throw new EncryptionException("No key reference on encrypted payload");
        }
        SecretKey key = keys.get(keyReference);
        if (key == null) {
            throw new EncryptionException("Unknown key reference: " + keyReference);
        }
        return key;
    }
}
