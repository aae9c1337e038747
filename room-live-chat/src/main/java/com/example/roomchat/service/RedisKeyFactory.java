package com.example.roomchat.service;

import com.example.roomchat.config.ChatProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final ChatProperties chatProperties;

    public RedisKeyFactory(ChatProperties chatProperties) {
        this.chatProperties = chatProperties;
    }

    private String prefix() {
        return chatProperties.getRedis().getKeyPrefix();
    }

    public String roomLockKey(String roomId) {
        return "%s:room:%s:lock".formatted(prefix(), roomId);
    }

    public String ownerLockKey(String ownerId) {
        return "%s:owner:%s:lock".formatted(prefix(), ownerId);
    }

    public String messageLockKey(String messageId) {
        return "%s:message:%s:lock".formatted(prefix(), messageId);
    }
}
