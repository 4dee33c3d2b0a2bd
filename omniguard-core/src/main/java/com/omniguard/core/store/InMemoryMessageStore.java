package com.omniguard.core.store;

import com.omniguard.core.domain.StoredMessage;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryMessageStore implements MessageStore {

    private final ConcurrentMap<String, StoredMessage> messages = new ConcurrentHashMap<>();

    @Override
    public void save(StoredMessage message) {
        Objects.requireNonNull(message, "Message cannot be null");
        messages.put(message.messageId(), message);
    }

    @Override
    public Optional<StoredMessage> find(String messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    @Override
    public boolean delete(String messageId) {
        return messages.remove(messageId) != null;
    }

    public int size() {
        return messages.size();
    }
}
