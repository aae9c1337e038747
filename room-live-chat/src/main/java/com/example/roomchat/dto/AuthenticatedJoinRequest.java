package com.example.roomchat.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.util.StringUtils;

@Data
public class AuthenticatedJoinRequest {

    @NotBlank
    private String code;

    private String userId;

    private String email;

    private String userName;

    @JsonIgnore
    @AssertTrue(message = "userId or email is required")
    public boolean isIdentified() {
        return StringUtils.hasText(userId) || StringUtils.hasText(email);
    }
}
