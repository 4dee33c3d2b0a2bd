package com.omniguard.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted message. Only the encrypted envelope is stored, never the plaintext.
 */
public record StoredMessage(String messageId, String identityId, EncryptedEnvelope envelope, Instant storedAt) {

    public StoredMessage {
        Objects.requireNonNull(messageId, "Message ID cannot be null");
        Objects.requireNonNull(identityId, "Identity ID cannot be null");
        Objects.requireNonNull(envelope, "Envelope cannot be null");
        Objects.requireNonNull(storedAt, "Stored time cannot be null");
    }

    public boolean ownedBy(Identity identity) {
        return identityId.equals(identity.id());
    }
}
