package com.example.roomchat.persistence;

import com.example.roomchat.domain.ChatMessage;
import com.example.roomchat.domain.Reaction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@RequiredArgsConstructor
public class MessageEntityMapper {

    private static final TypeReference<List<Reaction>> REACTION_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public MessageEntity toEntity(ChatMessage message) {
        MessageEntity entity = new MessageEntity();
        entity.setId(message.getId());
        entity.setRoomId(message.getRoomId());
        entity.setSenderUserId(message.getSenderUserId());
        entity.setSenderGuestName(message.getSenderGuestName());
        entity.setRole(message.getRole());
        entity.setContent(message.getContent() == null ? "" : message.getContent());
        entity.setMediaUrl(message.getMediaUrl());
        entity.setMediaType(message.getMediaType());
        entity.setMediaName(message.getMediaName());
        entity.setMimeType(message.getMimeType());
        entity.setReactions(writeJson(message.getReactions() == null ? List.of() : message.getReactions()));
        entity.setCreatedAt(message.getCreatedAt());
        return entity;
    }

    public ChatMessage toMessage(MessageEntity entity) {
        return ChatMessage.builder()
                .id(entity.getId())
                .roomId(entity.getRoomId())
                .senderUserId(entity.getSenderUserId())
                .senderGuestName(entity.getSenderGuestName())
                .role(entity.getRole())
                .content(entity.getContent())
                .mediaUrl(entity.getMediaUrl())
                .mediaType(entity.getMediaType())
                .mediaName(entity.getMediaName())
                .mimeType(entity.getMimeType())
                .reactions(readReactions(entity.getReactions()))
                .createdAt(entity.getCreatedAt())
                .build();
    }

    private List<Reaction> readReactions(String json) {
        if (!StringUtils.hasText(json)) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, REACTION_LIST));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to deserialize message reactions", e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize message reactions", e);
        }
    }
}
