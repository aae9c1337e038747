package com.example.roomchat.dto;

import com.example.roomchat.domain.ChatMessage;
import com.example.roomchat.domain.MessageRole;
import com.example.roomchat.domain.Reaction;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Wire shape of {@code receive_message} and of the message history endpoint.
 */
@Value
@Builder
public class MessagePayload {

    public static final String TEMPORARY_ID_PREFIX = "temp-";

    @JsonProperty("_id")
    String id;

    String roomId;
    String text;
    MessageRole role;
    String senderUserId;
    String senderGuestName;
    Instant createdAt;
    List<Reaction> reactions;
    String mediaUrl;
    String mediaType;
    String mediaName;

    public static MessagePayload from(ChatMessage message) {
        return MessagePayload.builder()
                .id(message.getId())
                .roomId(message.getRoomId())
                .text(message.getContent() == null ? "" : message.getContent())
                .role(message.getRole())
                .senderUserId(message.getSenderUserId())
                .senderGuestName(message.getSenderGuestName())
                .createdAt(message.getCreatedAt())
                .reactions(message.getReactions() == null ? List.of() : List.copyOf(message.getReactions()))
                .mediaUrl(message.getMediaUrl())
                .mediaType(message.getMediaType())
                .mediaName(message.getMediaName())
                .build();
    }

    public boolean isTemporary() {
        return id != null && id.startsWith(TEMPORARY_ID_PREFIX);
    }
}
