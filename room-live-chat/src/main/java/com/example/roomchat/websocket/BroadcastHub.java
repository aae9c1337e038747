package com.example.roomchat.websocket;

import com.corundumstudio.socketio.BroadcastOperations;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.roomchat.call.CallEvent;
import com.example.roomchat.call.CallEventListener;
import com.example.roomchat.domain.Room;
import com.example.roomchat.service.RoomStore;
import com.example.roomchat.service.VisibilityFilter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Delivers events to one connection, to a room group, or to every live connection with a
 * per-recipient visibility filter.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BroadcastHub implements CallEventListener {

    public static final String ROOM_LIST_EVENT = "room_list_update";
    public static final String PRESENCE_EVENT = "active_users_update";
    public static final String SYSTEM_MESSAGE_EVENT = "system_message";

    private final SocketIOServer socketIOServer;
    private final IdentityBinder identityBinder;
    private final RoomStore roomStore;

    public void sendTo(SocketIOClient client, String event, Object payload) {
        client.sendEvent(event, payload);
    }

    /**
     * @return {@code false} when the connection is gone
     */
    public boolean sendTo(UUID sessionId, String event, Object payload) {
        SocketIOClient client = socketIOServer.getClient(sessionId);
        if (client == null) {
            return false;
        }
        client.sendEvent(event, payload);
        return true;
    }

    public void toRoom(String roomKey, String event, Object payload) {
        socketIOServer.getRoomOperations(roomKey).sendEvent(event, payload);
    }

    public void toRoomExcept(String roomKey, UUID excludedSessionId, String event, Object payload) {
        BroadcastOperations operations = socketIOServer.getRoomOperations(roomKey);
        SocketIOClient excluded = excludedSessionId == null ? null : socketIOServer.getClient(excludedSessionId);
        if (excluded == null) {
            operations.sendEvent(event, payload);
        } else {
            operations.sendEvent(event, excluded, payload);
        }
    }

    public void joinGroup(SocketIOClient client, String roomKey) {
        client.joinRoom(roomKey);
        identityBinder.joinRoom(client.getSessionId(), roomKey);
    }

    public void leaveGroup(SocketIOClient client, String roomKey) {
        client.leaveRoom(roomKey);
        identityBinder.leaveRoom(client.getSessionId(), roomKey);
    }

    /**
     * Emits the number of connections currently in the room group, counted at delivery time.
     */
    public int emitPresence(String roomKey) {
        int count = socketIOServer.getRoomOperations(roomKey).getClients().size();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("roomId", roomKey);
        payload.put("count", count);
        toRoom(roomKey, PRESENCE_EVENT, payload);
        return count;
    }

    public void systemMessage(String roomKey, String content, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", content);
        payload.put("timestamp", System.currentTimeMillis());
        if (extra != null) {
            payload.putAll(extra);
        }
        toRoom(roomKey, SYSTEM_MESSAGE_EVENT, payload);
    }

    /** Sends the rooms visible to this connection's current identity. */
    public void sendRoomList(SocketIOClient client) {
        try {
            List<Room> rooms = roomStore.findAll();
            client.sendEvent(ROOM_LIST_EVENT, VisibilityFilter.visible(rooms, identityBinder.identityOf(client.getSessionId())));
        } catch (RuntimeException ex) {
            log.error("Failed to load rooms for connection {}", client.getSessionId(), ex);
        }
    }

    /**
     * Refreshes the room list of every live connection. This scans all connections on each
     * mutation; interest registration per room would be needed beyond a single node's scale.
     */
    public void broadcastRoomList() {
        List<Room> rooms;
        try {
            rooms = roomStore.findAll();
        } catch (RuntimeException ex) {
            log.error("Failed to load rooms for broadcast", ex);
            return;
        }
        Collection<SocketIOClient> clients = socketIOServer.getAllClients();
        for (SocketIOClient client : clients) {
            List<Room> visible = VisibilityFilter.visible(rooms, identityBinder.identityOf(client.getSessionId()));
            client.sendEvent(ROOM_LIST_EVENT, visible);
        }
        log.debug("Room list refreshed for {} connection(s)", clients.size());
    }

    @Override
    public void onCallEvent(CallEvent event) {
        String eventName = event.getType().eventName();
        switch (event.getType()) {
            case EXISTING_PEERS -> parseSessionId(event.getConnectionId())
                    .ifPresent(sessionId -> sendTo(sessionId, eventName, event.getPayload()));
            case CALL_ENDED -> toRoom(event.getRoomKey(), eventName, event.getPayload());
            default -> toRoomExcept(
                    event.getRoomKey(),
                    parseSessionId(event.getConnectionId()).orElse(null),
                    eventName,
                    event.getPayload());
        }
    }

    static Optional<UUID> parseSessionId(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(connectionId));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
