package com.example.roomchat.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import lombok.Data;
import org.springframework.util.StringUtils;

@Data
public class SendMessageRequest {

    @NotBlank
    private String roomId;

    @Size(max = 10_000)
    private String text;

    @Pattern(regexp = "user|ai|system")
    private String role = "user";

    private String senderUserId;

    private String senderGuestName;

    private String mediaUrl;

    private String mediaType;

    private String mediaName;

    private String mimeType;

    /** Client clock; only used when the message cannot be persisted. */
    private Instant createdAt;

    @JsonIgnore
    @AssertTrue(message = "text or mediaUrl is required")
    public boolean isContentPresent() {
        return StringUtils.hasText(text) || StringUtils.hasText(mediaUrl);
    }
}
