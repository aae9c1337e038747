package com.example.roomchat.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RoomActionRequest {

    @NotBlank
    private String roomId;
}
