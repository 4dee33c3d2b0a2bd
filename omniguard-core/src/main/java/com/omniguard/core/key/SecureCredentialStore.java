package com.omniguard.core.key;

import javax.crypto.SecretKey;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Holds symmetric message keys by identifier.
 * Implementations may be backed by a hardware module or a managed key service.
 */
public interface SecureCredentialStore {

    /**
     * Stores a key under the given identifier.
     *
     * @throws IllegalStateException if a key with this identifier already exists
     */
    void storeKey(String keyId, SecretKey key, Instant createdAt);

    Optional<SecretKey> loadKey(String keyId);

    /**
     * Returns the identifiers of stored keys, oldest first.
     */
    List<String> keyIds();

    boolean isHardwareBacked();
}
