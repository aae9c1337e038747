package com.example.roomchat.persistence;

import com.example.roomchat.domain.ChatMessage;
import com.example.roomchat.service.MessageStore;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaMessageStore implements MessageStore {

    private final MessageJpaRepository messageJpaRepository;
    private final MessageEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> findByRoom(String roomId, int limit) {
        if (!StringUtils.hasText(roomId) || limit <= 0) {
            return List.of();
        }
        return messageJpaRepository.findByRoomIdOrderByCreatedAtAsc(roomId, PageRequest.of(0, limit)).stream()
                .map(mapper::toMessage)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChatMessage> findById(String messageId) {
        if (!StringUtils.hasText(messageId)) {
            return Optional.empty();
        }
        return messageJpaRepository.findById(messageId).map(mapper::toMessage);
    }

    @Override
    @Transactional
    public ChatMessage create(ChatMessage message) {
        if (!StringUtils.hasText(message.getId())) {
            message.setId(UUID.randomUUID().toString());
        }
        if (message.getCreatedAt() == null) {
            message.setCreatedAt(Instant.now());
        }
        messageJpaRepository.save(mapper.toEntity(message));
        return message;
    }

    @Override
    @Transactional
    public ChatMessage update(ChatMessage message) {
        messageJpaRepository.save(mapper.toEntity(message));
        return message;
    }

    @Override
    @Transactional
    public void delete(String messageId) {
        if (StringUtils.hasText(messageId)) {
            messageJpaRepository.deleteById(messageId);
        }
    }

    @Override
    @Transactional
    public void deleteByRoom(String roomId) {
        if (StringUtils.hasText(roomId)) {
            messageJpaRepository.deleteByRoomId(roomId);
        }
    }
}
