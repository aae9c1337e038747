package com.example.roomchat.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RenameRoomRequest {

    @NotBlank
    private String roomId;

    @NotBlank
    @Size(max = 255)
    private String newName;
}
