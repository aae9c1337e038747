package com.example.roomchat.service;

import com.example.roomchat.domain.ChatMessage;
import java.util.List;
import java.util.Optional;

public interface MessageStore {

    /** Messages of a room, oldest first, at most {@code limit}. */
    List<ChatMessage> findByRoom(String roomId, int limit);

    Optional<ChatMessage> findById(String messageId);

    ChatMessage create(ChatMessage message);

    ChatMessage update(ChatMessage message);

    void delete(String messageId);

    void deleteByRoom(String roomId);
}
