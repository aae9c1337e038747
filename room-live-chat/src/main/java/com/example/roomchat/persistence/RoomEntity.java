package com.example.roomchat.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "chat_rooms",
        indexes = {
            @Index(name = "idx_chat_rooms_owner", columnList = "owner_id"),
            @Index(name = "idx_chat_rooms_created", columnList = "created_at")
        })
public class RoomEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "owner_id", nullable = false, updatable = false, length = 255)
    private String ownerId;

    @Column(name = "code", nullable = false, unique = true, length = 16)
    private String code;

    @Column(name = "invite_link_id", length = 32)
    private String inviteLinkId;

    @Column(name = "allow_ai", nullable = false)
    private boolean allowAi;

    @Column(name = "members", columnDefinition = "text")
    private String members;

    @Column(name = "theme", length = 64)
    private String theme;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
