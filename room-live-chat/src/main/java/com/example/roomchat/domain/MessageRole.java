package com.example.roomchat.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MessageRole {
    USER,
    AI,
    SYSTEM;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageRole fromValue(String value) {
        if (value == null || value.isBlank()) {
            return USER;
        }
        return MessageRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
