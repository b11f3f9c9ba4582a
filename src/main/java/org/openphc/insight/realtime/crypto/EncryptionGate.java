package org.openphc.insight.realtime.crypto;

import lombok.RequiredArgsConstructor;
import org.openphc.insight.realtime.api.exception.EncryptionException;
import org.openphc.insight.realtime.domain.model.enums.FieldClassification;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM for protected payload fields. The ciphertext is {@code base64(iv || ct+tag)}
 * and the classification name is bound in as associated data, so a value moved to a field of
 * another classification fails authentication.
 */
@Component
@RequiredArgsConstructor
public class EncryptionGate {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;

    private final KeyService keyService;
    private final SecureRandom secureRandom = new SecureRandom();

    public String encrypt(String plaintext, FieldClassification classification, String keyReference) {
        if (plaintext == null) {
            throw new EncryptionException("Nothing to encrypt");
        }
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, keyService.resolve(keyReference),
                    new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            cipher.updateAAD(aad(classification));
            byte[] ct = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(
                    ByteBuffer.allocate(iv.length + ct.length).put(iv).put(ct).array());
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Encryption failed for " + classification, e);
        }
    }

    public String decrypt(String ciphertext, FieldClassification classification, String keyReference) {
        if (ciphertext == null || ciphertext.isBlank()) {
            throw new EncryptionException("Missing ciphertext for " + classification);
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new EncryptionException("Ciphertext for " + classification + " is not Base64", e);
        }
        if (decoded.length <= IV_LENGTH + TAG_LENGTH_BITS / 8) {
            throw new EncryptionException("Ciphertext for " + classification + " is truncated");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, keyService.resolve(keyReference),
                    new GCMParameterSpec(TAG_LENGTH_BITS, decoded, 0, IV_LENGTH));
            cipher.updateAAD(aad(classification));
            byte[] pt = cipher.doFinal(decoded, IV_LENGTH, decoded.length - IV_LENGTH);
            return new String(pt, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Decryption failed for " + classification, e);
        }
    }

    private static byte[] aad(FieldClassification classification) {
        return classification.name().getBytes(StandardCharsets.UTF_8);
    }
}
