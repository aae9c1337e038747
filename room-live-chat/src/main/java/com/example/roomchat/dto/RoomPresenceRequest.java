package com.example.roomchat.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Payload of {@code join_room}, {@code leave_room}, {@code join_call} and {@code leave_call}.
 */
@Data
public class RoomPresenceRequest {

    @NotBlank
    private String roomId;

    private String displayName;
}
