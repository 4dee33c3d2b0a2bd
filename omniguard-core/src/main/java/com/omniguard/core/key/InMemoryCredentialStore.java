package com.omniguard.core.key;

import javax.crypto.SecretKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Credential store kept in process memory. Keys do not survive a restart.
 */
public class InMemoryCredentialStore implements SecureCredentialStore {

    private final Map<String, StoredKey> keys = new LinkedHashMap<>();

    @Override
    public synchronized void storeKey(String keyId, SecretKey key, Instant createdAt) {
        Objects.requireNonNull(keyId, "Key ID cannot be null");
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(createdAt, "Creation time cannot be null");
        if (keys.containsKey(keyId)) {
            throw new IllegalStateException("Key already exists: " + keyId);
        }
        keys.put(keyId, new StoredKey(key, createdAt));
    }

    @Override
    public synchronized Optional<SecretKey> loadKey(String keyId) {
        StoredKey stored = keys.get(keyId);
        return stored == null ? Optional.empty() : Optional.of(stored.key());
    }

    @Override
    public synchronized List<String> keyIds() {
        return new ArrayList<>(keys.keySet());
    }

    @Override
    public boolean isHardwareBacked() {
        return false;
    }

    private record StoredKey(SecretKey key, Instant createdAt) {}
}
