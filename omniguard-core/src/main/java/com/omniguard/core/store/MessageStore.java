package com.omniguard.core.store;

import com.omniguard.core.domain.StoredMessage;

import java.util.Optional;

/**
 * Persistence port for encrypted messages.
 */
public interface MessageStore {

    void save(StoredMessage message);

    Optional<StoredMessage> find(String messageId);

    boolean delete(String messageId);
}
