package com.omniguard.core.domain;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Authenticated ciphertext with everything needed to decrypt it except the key material.
 * Byte arrays are copied on the way in and out.
 */
public record EncryptedEnvelope(String keyId, byte[] nonce, byte[] ciphertext, byte[] tag) {

    public EncryptedEnvelope {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key ID cannot be null or blank");
        }
        Objects.requireNonNull(nonce, "Nonce cannot be null");
        Objects.requireNonNull(ciphertext, "Ciphertext cannot be null");
        Objects.requireNonNull(tag, "Tag cannot be null");
        nonce = nonce.clone();
        ciphertext = ciphertext.clone();
        tag = tag.clone();
    }

    @Override
    public byte[] nonce() {
        return nonce.clone();
    }

    @Override
    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    @Override
    public byte[] tag() {
        return tag.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncryptedEnvelope other)) return false;
        return keyId.equals(other.keyId)
                && Arrays.equals(nonce, other.nonce)
                && Arrays.equals(ciphertext, other.ciphertext)
                && Arrays.equals(tag, other.tag);
    }

    @Override
    public int hashCode() {
        int result = keyId.hashCode();
        result = 31 * result + Arrays.hashCode(nonce);
        result = 31 * result + Arrays.hashCode(ciphertext);
        result = 31 * result + Arrays.hashCode(tag);
        return result;
    }

    @Override
    public String toString() {
        Base64.Encoder b64 = Base64.getEncoder();
        return "EncryptedEnvelope[keyId=" + keyId
                + ", nonce=" + b64.encodeToString(nonce)
                + ", ciphertextLength=" + ciphertext.length
                + ", tag=" + b64.encodeToString(tag) + "]";
    }
}
