package com.example.roomchat.websocket;

import com.example.roomchat.domain.ConnectionIdentity;
import com.example.roomchat.service.RandomTokens;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Registry of live connections and the identity each one is bound to.
 */
@Slf4j
@Component
public class IdentityBinder {

    private final Map<UUID, SessionBinding> bindings = new ConcurrentHashMap<>();

    public SessionBinding attach(UUID sessionId) {
        return bindings.computeIfAbsent(sessionId, SessionBinding::new);
    }

    public boolean isAttached(UUID sessionId) {
        return bindings.containsKey(sessionId);
    }

    /**
     * Replaces the connection's identity. Absent parts become {@code null}; nothing is merged
     * with the previous identity.
     */
    public ConnectionIdentity bind(UUID sessionId, String userId, String userEmail) {
        ConnectionIdentity identity = ConnectionIdentity.of(userId, userEmail);
        SessionBinding binding = bindings.get(sessionId);
        if (binding == null) {
            log.debug("Ignoring identity bind for released connection {}", sessionId);
            return identity;
        }
        binding.setIdentity(identity);
        log.debug("Connection {} bound to {}", sessionId, identity);
        return identity;
    }

    public ConnectionIdentity identityOf(UUID sessionId) {
        SessionBinding binding = bindings.get(sessionId);
        return binding == null ? ConnectionIdentity.anonymous() : binding.getIdentity();
    }

    public String newGuestId() {
        return RandomTokens.guestId();
    }

    void joinRoom(UUID sessionId, String roomKey) {
        SessionBinding binding = bindings.get(sessionId);
        if (binding != null) {
            binding.addRoom(roomKey);
        }
    }

    void leaveRoom(UUID sessionId, String roomKey) {
        SessionBinding binding = bindings.get(sessionId);
        if (binding != null) {
            binding.removeRoom(roomKey);
        }
    }

    public Set<String> roomsOf(UUID sessionId) {
        SessionBinding binding = bindings.get(sessionId);
        return binding == null ? Set.of() : binding.getRoomKeys();
    }

    public Optional<SessionBinding> release(UUID sessionId) {
        return Optional.ofNullable(bindings.remove(sessionId));
    }

    public int connectionCount() {
        return bindings.size();
    }
}
