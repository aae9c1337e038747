package com.example.roomchat.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage implements Serializable {

    private String id;
    private String roomId;
    private String senderUserId;
    private String senderGuestName;
    private MessageRole role;
    private String content;
    private String mediaUrl;
    private String mediaType;
    private String mediaName;
    private String mimeType;

    @Builder.Default
    private List<Reaction> reactions = new ArrayList<>();

    private Instant createdAt;
}
