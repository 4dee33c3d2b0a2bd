package com.omniguard.api.crypto;

import com.omniguard.core.domain.EncryptedEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Authenticated message encryption with AES-256-GCM.
 * <p>
 * The key identifier is bound as associated data, so an envelope relabelled with another
 * key id fails authentication. Nonces are 8 random bytes followed by a 4-byte per-key
 * counter; encryption refuses to continue once a key's counter space is spent.
 */
@Service
public class MessageCipherService {

    private static final Logger log = LoggerFactory.getLogger(MessageCipherService.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    static final int GCM_IV_LENGTH = 12;
    static final int GCM_TAG_LENGTH = 128;
    static final int TAG_BYTES = GCM_TAG_LENGTH / 8;
    private static final int RANDOM_PREFIX_LENGTH = 8;
    static final long MAX_MESSAGES_PER_KEY = 1L << 32;

    private final KeyRing keyRing;
    private final SecureRandom secureRandom = new SecureRandom();
    private final Map<String, AtomicLong> nonceCounters = new ConcurrentHashMap<>();

    public MessageCipherService(KeyRing keyRing) {
        this.keyRing = Objects.requireNonNull(keyRing, "Key ring cannot be null");
    }

    /**
     * Encrypts under the currently active key.
     */
    public EncryptedEnvelope encrypt(String plaintext) {
        return encrypt(plaintext, keyRing.activeKeyId());
    }

    /**
     * Encrypts under the given key.
     *
     * @throws EncryptionException if the key is unknown, its nonce space is exhausted, or the cipher fails
     */
    public EncryptedEnvelope encrypt(String plaintext, String keyId) {
        Objects.requireNonNull(plaintext, "Plaintext cannot be null");
        SecretKey key;
        try {
            key = keyRing.resolve(keyId);
        } catch (KeyRing.KeyNotFoundException e) {
            throw new EncryptionException("Unknown key " + keyId, e);
        }

        byte[] nonce = nextNonce(keyId);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
            cipher.updateAAD(keyId.getBytes(StandardCharsets.UTF_8));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_BYTES);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_BYTES, sealed.length);
            return new EncryptedEnvelope(keyId, nonce, ciphertext, tag);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Encryption failed under key " + keyId, e);
        }
    }

    /**
     * Decrypts with the key named in the envelope.
     *
     * @throws IntegrityException if the key is unknown or authentication fails
     */
    public String decrypt(EncryptedEnvelope envelope) {
        Objects.requireNonNull(envelope, "Envelope cannot be null");
        SecretKey key;
        try {
            key = keyRing.resolve(envelope.keyId());
        } catch (KeyRing.KeyNotFoundException e) {
            throw new IntegrityException(envelope.keyId(), "Unknown key", e);
        }
        return decrypt(envelope, key);
    }

    /**
     * Decrypts with explicit key material. Any mismatch in key, nonce, tag, ciphertext or
     * key id yields an {@link IntegrityException}; partial plaintext is never returned.
     */
    public String decrypt(EncryptedEnvelope envelope, SecretKey key) {
        Objects.requireNonNull(envelope, "Envelope cannot be null");
        Objects.requireNonNull(key, "Key cannot be null");
        byte[] nonce = envelope.nonce();
        byte[] tag = envelope.tag();
        if (nonce.length != GCM_IV_LENGTH || tag.length != TAG_BYTES) {
            throw new IntegrityException(envelope.keyId(), "Malformed envelope", null);
        }

        byte[] ciphertext = envelope.ciphertext();
        byte[] sealed = ByteBuffer.allocate(ciphertext.length + tag.length)
                .put(ciphertext)
                .put(tag)
                .array();
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
            cipher.updateAAD(envelope.keyId().getBytes(StandardCharsets.UTF_8));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            log.error("Authentication failed for envelope under key {}", envelope.keyId());
            throw new IntegrityException(envelope.keyId(), "Authentication failed", e);
        } catch (GeneralSecurityException e) {
            throw new IntegrityException(envelope.keyId(), "Decryption failed", e);
        }
    }

    private byte[] nextNonce(String keyId) {
        long counter = nonceCounters.computeIfAbsent(keyId, k -> new AtomicLong()).getAndIncrement();
        if (counter >= MAX_MESSAGES_PER_KEY) {
            log.error("Nonce space exhausted for key {}", keyId);
            throw new EncryptionException("Nonce space exhausted for key " + keyId + ", rotate the key", null);
        }
        byte[] prefix = new byte[RANDOM_PREFIX_LENGTH];
        secureRandom.nextBytes(prefix);
        return ByteBuffer.allocate(GCM_IV_LENGTH)
                .put(prefix)
                .putInt((int) counter)
                .array();
    }

    /**
     * Advances a key's nonce counter, used to exercise exhaustion handling.
     */
    void advanceNonceCounter(String keyId, long value) {
        nonceCounters.computeIfAbsent(keyId, k -> new AtomicLong()).set(value);
    }

    public static class EncryptionException extends RuntimeException {
        public EncryptionException(String message, Throwable cause) { super(message, cause); }
    }

    public static class IntegrityException extends RuntimeException {
        private final String keyId;

        public IntegrityException(String keyId, String message, Throwable cause) {
            super(message + " (key " + keyId + ")", cause);
            this.keyId = keyId;
        }

        public String keyId() {
            return keyId;
        }
    }
}
