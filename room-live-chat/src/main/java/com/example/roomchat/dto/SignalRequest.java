package com.example.roomchat.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * WebRTC negotiation payload addressed to another connection. {@code sdp} and {@code candidate}
 * are relayed verbatim.
 */
@Data
public class SignalRequest {

    @NotBlank
    private String to;

    private Object sdp;

    private Object candidate;
}
