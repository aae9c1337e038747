package com.example.roomchat.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/** Body of {@code POST /api/rooms/join}. Without a user id the joiner is recorded as a fresh guest. */
@Data
public class JoinRoomRequest {

    @NotBlank
    private String code;

    private String userId;

    private String userName;
}
