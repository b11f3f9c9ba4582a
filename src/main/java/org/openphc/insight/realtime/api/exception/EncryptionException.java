package org.openphc.insight.realtime.api.exception;

/**
 * A protected field could not be encrypted or decrypted. Never carries plaintext.
 */
public class EncryptionException extends RuntimeException {

    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
