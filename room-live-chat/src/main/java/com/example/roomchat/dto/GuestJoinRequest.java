package com.example.roomchat.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class GuestJoinRequest {

    @NotBlank
    private String code;

    @NotBlank
    @Size(max = 64)
    private String name;

    /** Stable guest id remembered by the client; generated when absent. */
    private String guestId;
}
