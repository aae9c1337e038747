package com.example.roomchat.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MemberRole {
    OWNER,
    MEMBER,
    GUEST;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MemberRole fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MEMBER;
        }
        return MemberRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
