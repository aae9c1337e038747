package com.example.roomchat.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ReactionRequest {

    @NotBlank
    private String messageId;

    @NotBlank
    @Size(max = 32)
    private String emoji;

    @NotBlank
    private String userId;

    private String displayName;
}
