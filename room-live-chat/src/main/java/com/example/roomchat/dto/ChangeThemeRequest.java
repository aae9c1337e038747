package com.example.roomchat.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ChangeThemeRequest {

    @NotBlank
    private String roomId;

    @NotBlank
    @Size(max = 64)
    private String theme;

    private String changedBy;
}
