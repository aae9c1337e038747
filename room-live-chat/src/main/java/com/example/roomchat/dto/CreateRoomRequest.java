package com.example.roomchat.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateRoomRequest {

    @NotBlank
    @Size(max = 255)
    private String name;

    /** Owner email or id; falls back to the connection's bound identity. */
    private String ownerId;

    private String ownerName;

    private Boolean allowAI;
}
