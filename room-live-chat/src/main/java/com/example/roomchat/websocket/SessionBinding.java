package com.example.roomchat.websocket;

import com.example.roomchat.domain.ConnectionIdentity;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server-side state of one live connection: its bound identity and the room groups it joined.
 * Created on connect and discarded on disconnect.
 */
public class SessionBinding {

    private final UUID sessionId;
    private final Instant connectedAt;
    private final Set<String> roomKeys = ConcurrentHashMap.newKeySet();
    private volatile ConnectionIdentity identity = ConnectionIdentity.anonymous();

    public SessionBinding(UUID sessionId) {
        this.sessionId = sessionId;
        this.connectedAt = Instant.now();
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public ConnectionIdentity getIdentity() {
        return identity;
    }

    void setIdentity(ConnectionIdentity identity) {
        this.identity = identity;
    }

    public Set<String> getRoomKeys() {
        return Set.copyOf(roomKeys);
    }

    boolean addRoom(String roomKey) {
        return roomKeys.add(roomKey);
    }

    boolean removeRoom(String roomKey) {
        return roomKeys.remove(roomKey);
    }
}
