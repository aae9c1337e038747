package com.example.roomchat.service;

import com.example.roomchat.domain.ChatMessage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.dao.DataAccessResourceFailureException;

class InMemoryMessageStore implements MessageStore {

    private final Map<String, ChatMessage> messages = new ConcurrentHashMap<>();
    private volatile boolean failWrites;

    void failWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    @Override
    public List<ChatMessage> findByRoom(String roomId, int limit) {
        List<ChatMessage> inRoom = messages.values().stream()
                .filter(message -> Objects.equals(message.getRoomId(), roomId))
                .sorted(Comparator.comparing(ChatMessage::getCreatedAt))
                .map(InMemoryMessageStore::copy)
                .toList();
        return inRoom.subList(Math.max(0, inRoom.size() - limit), inRoom.size());
    }

    @Override
    public Optional<ChatMessage> findById(String messageId) {
        return Optional.ofNullable(messages.get(messageId)).map(InMemoryMessageStore::copy);
    }

    @Override
    public ChatMessage create(ChatMessage message) {
        checkWritable();
        ChatMessage stored = copy(message);
        stored.setId(UUID.randomUUID().toString());
        if (stored.getCreatedAt() == null) {
            stored.setCreatedAt(Instant.now());
        }
        messages.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public ChatMessage update(ChatMessage message) {
        checkWritable();
        messages.put(message.getId(), copy(message));
        return copy(message);
    }

    @Override
    public void delete(String messageId) {
        checkWritable();
        messages.remove(messageId);
    }

    @Override
    public void deleteByRoom(String roomId) {
        messages.values().removeIf(message -> Objects.equals(message.getRoomId(), roomId));
    }

    ChatMessage put(ChatMessage message) {
        messages.put(message.getId(), copy(message));
        return message;
    }

    boolean contains(String messageId) {
        return messages.containsKey(messageId);
    }

    private void checkWritable() {
        if (failWrites) {
            throw new DataAccessResourceFailureException("store unavailable");
        }
    }

    private static ChatMessage copy(ChatMessage message) {
        return message.toBuilder()
                .reactions(message.getReactions() == null ? new ArrayList<>() : new ArrayList<>(message.getReactions()))
                .build();
    }
}
