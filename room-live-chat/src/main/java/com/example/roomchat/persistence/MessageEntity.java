package com.example.roomchat.persistence;

import com.example.roomchat.domain.MessageRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "chat_messages", indexes = @Index(name = "idx_chat_messages_room", columnList = "room_id, created_at"))
public class MessageEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "room_id", nullable = false, length = 64)
    private String roomId;

    @Column(name = "sender_user_id", length = 255)
    private String senderUserId;

    @Column(name = "sender_guest_name", length = 255)
    private String senderGuestName;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private MessageRole role;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Column(name = "media_url", length = 1024)
    private String mediaUrl;

    @Column(name = "media_type", length = 64)
    private String mediaType;

    @Column(name = "media_name", length = 255)
    private String mediaName;

    @Column(name = "mime_type", length = 128)
    private String mimeType;

    @Column(name = "reactions", columnDefinition = "text")
    private String reactions;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
