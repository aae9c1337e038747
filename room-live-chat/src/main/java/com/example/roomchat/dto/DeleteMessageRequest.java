package com.example.roomchat.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class DeleteMessageRequest {

    @NotBlank
    private String messageId;

    private String requesterUserId;

    private String requesterGuestName;

    /** Used only when the stored message has lost its room reference. */
    private String roomId;
}
