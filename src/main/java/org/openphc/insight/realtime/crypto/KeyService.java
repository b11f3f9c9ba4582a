package org.openphc.insight.realtime.crypto;

import javax.crypto.SecretKey;

/**
 * Resolves the data key named by a payload's key reference.
 */
public interface KeyService {

    /**
     * @throws org.openphc.insight.realtime.api.exception.EncryptionException when the
     *         reference is unknown or the key material is unusable
     */
    SecretKey resolve(String keyReference);
}
