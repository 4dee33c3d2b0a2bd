package com.omniguard.api.crypto;

import com.omniguard.api.config.OmniGuardProperties;
import com.omniguard.core.key.SecureCredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks the active message key and resolves retired keys by identifier.
 * <p>
 * Rotation generates a fresh AES-256 key and makes it active for new messages.
 * Retired keys stay in the credential store so older envelopes remain readable.
 */
@Service
public class KeyRing {

    private static final Logger log = LoggerFactory.getLogger(KeyRing.class);
    private static final int AES_KEY_SIZE = 256;

    private final SecureCredentialStore credentialStore;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();
    private final AtomicReference<String> activeKeyId = new AtomicReference<>();

    public KeyRing(SecureCredentialStore credentialStore, OmniGuardProperties properties, Clock clock) {
        this.credentialStore = Objects.requireNonNull(credentialStore, "Credential store cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        initialize(properties.getCipher().getInitialKeyId());
    }

    private void initialize(String initialKeyId) {
        if (!credentialStore.isHardwareBacked()) {
            log.warn("Message keys are held in software; use a hardware-backed credential store in production");
        }
        List<String> existing = credentialStore.keyIds();
        if (existing.isEmpty()) {
            credentialStore.storeKey(initialKeyId, generateKey(), clock.instant());
            activeKeyId.set(initialKeyId);
            log.info("Generated initial message key {}", initialKeyId);
        } else {
            activeKeyId.set(existing.get(existing.size() - 1));
            log.info("Resumed with active message key {} ({} keys on record)", activeKeyId.get(), existing.size());
        }
    }

    public String activeKeyId() {
        return activeKeyId.get();
    }

    /**
     * Resolves key material for an identifier, active or retired.
     *
     * @throws KeyNotFoundException if no key is stored under the identifier
     */
    public SecretKey resolve(String keyId) {
        return credentialStore.loadKey(keyId)
                .orElseThrow(() -> new KeyNotFoundException(keyId));
    }

    /**
     * Generates and activates a new key. The previous key is retained for decryption.
     *
     * @return identifier of the new active key
     */
    public synchronized String rotate() {
        String previous = activeKeyId.get();
        String next = nextKeyId();
        credentialStore.storeKey(next, generateKey(), clock.instant());
        activeKeyId.set(next);
        log.info("Rotated message key {} -> {}", previous, next);
        return next;
    }

    public List<String> knownKeyIds() {
        return credentialStore.keyIds();
    }

    private String nextKeyId() {
        byte[] suffix = new byte[4];
        secureRandom.nextBytes(suffix);
        return "k" + clock.millis() + "-" + HexFormat.of().formatHex(suffix);
    }

    private SecretKey generateKey() {
        try {
            KeyGenerator keyGen = KeyGenerator.getInstance("AES");
            keyGen.init(AES_KEY_SIZE, secureRandom);
            return keyGen.generateKey();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("AES key generation unavailable", e);
        }
    }

    public static class KeyNotFoundException extends RuntimeException {
        private final String keyId;

        public KeyNotFoundException(String keyId) {
            super("No key stored for id " + keyId);
            this.keyId = keyId;
        }

        public String keyId() {
            return keyId;
        }
    }
}
