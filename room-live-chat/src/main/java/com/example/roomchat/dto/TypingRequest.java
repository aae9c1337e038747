package com.example.roomchat.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TypingRequest {

    @NotBlank
    private String roomId;

    @NotBlank
    private String displayName;
}
