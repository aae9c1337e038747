package com.example.roomchat.service;

import com.example.roomchat.service.exception.FailureReason;
import com.example.roomchat.service.exception.ServiceException;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Distributed locks around read-modify-write sequences on the document store. Locks are scoped
 * to one room, owner or message, so unrelated rooms never wait on each other.
 */
@Component
@RequiredArgsConstructor
public class ChatLockService {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;

    public <T> T withRoomLock(String roomId, Supplier<T> supplier) {
        requireKey(roomId, "Room id is required");
        return withLock(keyFactory.roomLockKey(roomId), supplier);
    }

    public <T> T withOwnerLock(String ownerId, Supplier<T> supplier) {
        requireKey(ownerId, "Owner id is required");
        return withLock(keyFactory.ownerLockKey(ownerId), supplier);
    }

    public <T> T withMessageLock(String messageId, Supplier<T> supplier) {
        requireKey(messageId, "Message id is required");
        return withLock(keyFactory.messageLockKey(messageId), supplier);
    }

    private <T> T withLock(String key, Supplier<T> supplier) {
        RLock lock = redissonClient.getLock(key);
        lock.lock();
        try {
            return supplier.get();
        } finally {
            lock.unlock();
        }
    }

    private void requireKey(String value, String message) {
        if (!StringUtils.hasText(value)) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, message, FailureReason.VALIDATION_ERROR);
        }
    }
}
