package com.example.roomchat.websocket;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.roomchat.call.CallSessionManager;
import com.example.roomchat.domain.ConnectionIdentity;
import com.example.roomchat.domain.MemberRole;
import com.example.roomchat.domain.RoomMember;
import com.example.roomchat.dto.AuthenticatedJoinRequest;
import com.example.roomchat.dto.ChangeThemeRequest;
import com.example.roomchat.dto.CreateRoomRequest;
import com.example.roomchat.dto.DeleteMessageRequest;
import com.example.roomchat.dto.GuestJoinRequest;
import com.example.roomchat.dto.ReactionRequest;
import com.example.roomchat.dto.RegisterUserRequest;
import com.example.roomchat.dto.RenameRoomRequest;
import com.example.roomchat.dto.RoomActionRequest;
import com.example.roomchat.dto.RoomPresenceRequest;
import com.example.roomchat.dto.SendMessageRequest;
import com.example.roomchat.dto.SignalRequest;
import com.example.roomchat.dto.TypingRequest;
import com.example.roomchat.service.MessageCoordinator;
import com.example.roomchat.service.RoomMutationCoordinator;
import com.example.roomchat.service.RoomMutationCoordinator.JoinResult;
import com.example.roomchat.service.exception.FailureReason;
import com.example.roomchat.service.exception.ServiceException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Maps inbound Socket.IO events to the coordinators. Every handler runs on the connection's
 * ordered task chain, validates its payload first and converts failures into a reply on the
 * originating connection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SocketIoEventRouter {

    static final String ERROR_EVENT = "system:error";

    static final String REGISTER_USER = "register_user";
    static final String REQUEST_ROOM_LIST = "request_room_list";
    static final String CREATE_ROOM = "create_room";
    static final String DELETE_ROOM = "delete_room";
    static final String RENAME_ROOM = "rename_room";
    static final String TOGGLE_ROOM_AI = "toggle_room_ai";
    static final String CHANGE_ROOM_THEME = "change_room_theme";
    static final String VERIFY_ROOM_CODE = "verify_room_code";
    static final String JOIN_ROOM_GUEST = "join_room_guest";
    static final String JOIN_ROOM_AUTHENTICATED = "join_room_authenticated";
    static final String JOIN_ROOM = "join_room";
    static final String LEAVE_ROOM = "leave_room";
    static final String SEND_MESSAGE = "send_message";
    static final String DELETE_MESSAGE = "delete_message";
    static final String ADD_REACTION = "addReaction";
    static final String TYPING = "typing";
    static final String JOIN_CALL = "join_call";
    static final String LEAVE_CALL = "leave_call";

    static final String GUEST_JOINED_EVENT = "guest_joined_success";
    static final String CALL_STARTED_EVENT = "call_started";

    private static final Map<String, String> FAILURE_EVENTS = Map.of(
            CREATE_ROOM, "room_create_failed",
            DELETE_ROOM, "room_delete_failed",
            RENAME_ROOM, "room_rename_failed",
            TOGGLE_ROOM_AI, "room_ai_toggle_failed",
            JOIN_ROOM_GUEST, "guest_join_failed");

    private static final Set<String> JOIN_EVENTS = Set.of(JOIN_ROOM_GUEST, JOIN_ROOM_AUTHENTICATED);

    private final SocketIOServer socketIOServer;
    private final IdentityBinder identityBinder;
    private final BroadcastHub broadcastHub;
    private final ConnectionTaskQueue taskQueue;
    private final CallSessionManager callSessionManager;
    private final RoomMutationCoordinator roomMutationCoordinator;
    private final MessageCoordinator messageCoordinator;
    private final SignalingRelay signalingRelay;
    private final Validator validator;

    private final List<String> registeredEvents = new ArrayList<>();

    @FunctionalInterface
    interface EventHandler<T> {
        void handle(SocketIOClient client, T payload, AckRequest ackRequest);
    }

    @PostConstruct
    public void registerListeners() {
        socketIOServer.addConnectListener(this::handleConnect);
        socketIOServer.addDisconnectListener(this::handleDisconnect);

        on(REGISTER_USER, RegisterUserRequest.class, this::registerUser);
        on(REQUEST_ROOM_LIST, Object.class, (client, payload, ack) -> broadcastHub.sendRoomList(client));
        on(CREATE_ROOM, CreateRoomRequest.class, this::createRoom);
        on(DELETE_ROOM, RoomActionRequest.class, this::deleteRoom);
        on(RENAME_ROOM, RenameRoomRequest.class, this::renameRoom);
        on(TOGGLE_ROOM_AI, String.class, this::toggleRoomAi);
        on(CHANGE_ROOM_THEME, ChangeThemeRequest.class,
                (client, payload, ack) -> roomMutationCoordinator.changeTheme(payload));
        on(VERIFY_ROOM_CODE, String.class, this::verifyRoomCode);
        on(JOIN_ROOM_GUEST, GuestJoinRequest.class, this::joinRoomAsGuest);
        on(JOIN_ROOM_AUTHENTICATED, AuthenticatedJoinRequest.class, this::joinRoomAuthenticated);
        on(JOIN_ROOM, RoomPresenceRequest.class, this::joinRoom);
        on(LEAVE_ROOM, RoomPresenceRequest.class, this::leaveRoom);
        on(SEND_MESSAGE, SendMessageRequest.class, (client, payload, ack) -> messageCoordinator.send(payload));
        on(DELETE_MESSAGE, DeleteMessageRequest.class, this::deleteMessage);
        on(ADD_REACTION, ReactionRequest.class, (client, payload, ack) -> messageCoordinator.toggleReaction(payload));
        on(TYPING, TypingRequest.class, this::typing);
        on(JOIN_CALL, RoomPresenceRequest.class, this::joinCall);
        on(LEAVE_CALL, RoomPresenceRequest.class, (client, payload, ack) ->
                callSessionManager.leave(payload.getRoomId(), client.getSessionId().toString()));
        on(SignalingRelay.OFFER_EVENT, SignalRequest.class,
                (client, payload, ack) -> signalingRelay.relayOffer(client.getSessionId(), payload));
        on(SignalingRelay.ANSWER_EVENT, SignalRequest.class,
                (client, payload, ack) -> signalingRelay.relayAnswer(client.getSessionId(), payload));
        on(SignalingRelay.ICE_CANDIDATE_EVENT, SignalRequest.class,
                (client, payload, ack) -> signalingRelay.relayIceCandidate(client.getSessionId(), payload));
        log.info("Registered {} Socket.IO event handlers", registeredEvents.size());
    }

    <T> void on(String event, Class<T> payloadType, EventHandler<T> handler) {
        registeredEvents.add(event);
        socketIOServer.addEventListener(event, payloadType, (client, payload, ackRequest) ->
                taskQueue.submit(client.getSessionId(), event,
                        () -> dispatch(event, payloadType, client, payload, ackRequest, handler)));
    }

    <T> void dispatch(
            String event, Class<T> payloadType, SocketIOClient client, T payload, AckRequest ackRequest,
            EventHandler<T> handler) {
        UUID sessionId = client.getSessionId();
        if (!identityBinder.isAttached(sessionId)) {
            log.debug("Skipping {} for released connection {}", event, sessionId);
            return;
        }
        try {
            validate(event, payloadType, payload);
            handler.handle(client, payload, ackRequest);
        } catch (ServiceException ex) {
            log.debug("{} rejected for {}: {} {}", event, sessionId, ex.getReason(), ex.getMessage());
            fail(event, client, ackRequest, ex.getReason(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Failed to handle {} for {}", event, sessionId, ex);
            fail(event, client, ackRequest, FailureReason.SERVER_ERROR, "Unexpected server error.");
        }
    }

    void handleConnect(SocketIOClient client) {
        identityBinder.attach(client.getSessionId());
        log.info("Client {} connected from {}", client.getSessionId(), client.getRemoteAddress());
    }

    /**
     * Releases everything derived from the connection before returning: call participation,
     * room groups and the bound identity. Presence is then refreshed for every room it was in.
     */
    void handleDisconnect(SocketIOClient client) {
        UUID sessionId = client.getSessionId();
        // Released first so a join_call already past its attach check sees the detach and backs out.
        Optional<SessionBinding> binding = identityBinder.release(sessionId);
        List<String> calls = callSessionManager.disconnect(sessionId.toString());

        Set<String> rooms = new LinkedHashSet<>(calls);
        binding.ifPresent(released -> rooms.addAll(released.getRoomKeys()));
        for (String roomKey : rooms) {
            client.leaveRoom(roomKey);
        }
        for (String roomKey : rooms) {
            try {
                broadcastHub.emitPresence(roomKey);
            } catch (RuntimeException ex) {
                log.warn("Failed to refresh presence of room {} after disconnect", roomKey, ex);
            }
        }
        taskQueue.release(sessionId);
        log.info("Client {} disconnected, left {} room(s) and {} call(s)", sessionId, rooms.size(), calls.size());
    }

    private void registerUser(SocketIOClient client, RegisterUserRequest request, AckRequest ackRequest) {
        identityBinder.bind(client.getSessionId(), request.getUserId(), request.getEmail());
        broadcastHub.sendRoomList(client);
    }

    private void createRoom(SocketIOClient client, CreateRoomRequest request, AckRequest ackRequest) {
        roomMutationCoordinator.create(identityOf(client), request);
    }

    private void deleteRoom(SocketIOClient client, RoomActionRequest request, AckRequest ackRequest) {
        roomMutationCoordinator.delete(request.getRoomId(), identityOf(client));
    }

    private void renameRoom(SocketIOClient client, RenameRoomRequest request, AckRequest ackRequest) {
        roomMutationCoordinator.rename(request.getRoomId(), request.getNewName(), identityOf(client));
    }

    private void toggleRoomAi(SocketIOClient client, String roomId, AckRequest ackRequest) {
        if (!StringUtils.hasText(roomId)) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Room id is required", FailureReason.VALIDATION_ERROR);
        }
        roomMutationCoordinator.toggleAI(roomId, identityOf(client))
                .ifPresent(room -> broadcastHub.sendRoomList(client));
    }

    private void verifyRoomCode(SocketIOClient client, String code, AckRequest ackRequest) {
        ack(ackRequest, roomMutationCoordinator.verifyCode(code).orElse(null));
    }

    private void joinRoomAsGuest(SocketIOClient client, GuestJoinRequest request, AckRequest ackRequest) {
        String guestId = StringUtils.hasText(request.getGuestId())
                ? request.getGuestId().trim()
                : identityBinder.newGuestId();
        String name = request.getName().trim();
        RoomMember candidate = RoomMember.builder().id(guestId).name(name).role(MemberRole.GUEST).build();

        JoinResult result = roomMutationCoordinator.joinByCode(request.getCode().trim(), candidate, List.of(guestId));
        String roomKey = result.getRoom().getId();

        broadcastHub.joinGroup(client, roomKey);
        identityBinder.bind(client.getSessionId(), guestId, null);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("room", result.getRoom());
        response.put("userId", guestId);
        response.put("displayName", name);
        broadcastHub.sendTo(client, GUEST_JOINED_EVENT, response);

        broadcastHub.systemMessage(roomKey, name + " joined", null);
        broadcastHub.broadcastRoomList();
        broadcastHub.emitPresence(roomKey);
    }

    private void joinRoomAuthenticated(SocketIOClient client, AuthenticatedJoinRequest request, AckRequest ackRequest) {
        String userId = trimToNull(request.getUserId());
        String email = trimToNull(request.getEmail());
        List<String> knownIds = new ArrayList<>(2);
        if (userId != null) {
            knownIds.add(userId);
        }
        if (email != null) {
            knownIds.add(email);
        }
        RoomMember candidate = RoomMember.builder()
                .id(userId != null ? userId : email)
                .name(firstText(request.getUserName(), email, "Member"))
                .role(MemberRole.MEMBER)
                .build();

        JoinResult result = roomMutationCoordinator.joinByCode(request.getCode().trim(), candidate, knownIds);
        String roomKey = result.getRoom().getId();

        broadcastHub.joinGroup(client, roomKey);
        ConnectionIdentity current = identityOf(client);
        identityBinder.bind(client.getSessionId(),
                userId != null ? userId : current.getUserId(),
                email != null ? email : current.getUserEmail());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("ok", true);
        response.put("room", result.getRoom());
        ack(ackRequest, response);

        broadcastHub.systemMessage(roomKey, firstText(request.getUserName(), email, "Someone") + " joined the room.", null);
        broadcastHub.emitPresence(roomKey);
        broadcastHub.broadcastRoomList();
    }

    private void joinRoom(SocketIOClient client, RoomPresenceRequest request, AckRequest ackRequest) {
        String roomKey = request.getRoomId();
        String displayName = trimToNull(request.getDisplayName());
        broadcastHub.joinGroup(client, roomKey);

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("roomId", roomKey);
        extra.put("type", "join");
        extra.put("displayName", displayName);
        broadcastHub.systemMessage(roomKey, firstText(displayName, null, "Someone") + " joined", extra);

        callSessionManager.find(roomKey).ifPresent(session -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("roomId", roomKey);
            payload.put("startedBy", firstText(session.getStartedBy(), null, "Someone"));
            broadcastHub.sendTo(client, CALL_STARTED_EVENT, payload);
        });

        broadcastHub.emitPresence(roomKey);
        broadcastHub.broadcastRoomList();
    }

    private void leaveRoom(SocketIOClient client, RoomPresenceRequest request, AckRequest ackRequest) {
        broadcastHub.leaveGroup(client, request.getRoomId());
        broadcastHub.emitPresence(request.getRoomId());
    }

    private void deleteMessage(SocketIOClient client, DeleteMessageRequest request, AckRequest ackRequest) {
        messageCoordinator.delete(request, identityOf(client));
        ack(ackRequest, Map.of("ok", true));
    }

    private void typing(SocketIOClient client, TypingRequest request, AckRequest ackRequest) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("roomId", request.getRoomId());
        payload.put("displayName", request.getDisplayName());
        broadcastHub.toRoomExcept(request.getRoomId(), client.getSessionId(), TYPING, payload);
    }

    private void joinCall(SocketIOClient client, RoomPresenceRequest request, AckRequest ackRequest) {
        String roomKey = request.getRoomId();
        String connectionId = client.getSessionId().toString();
        broadcastHub.joinGroup(client, roomKey);
        callSessionManager.join(roomKey, connectionId, trimToNull(request.getDisplayName()));
        // A disconnect may have run between the attach check and the join; its call cleanup then
        // missed this participant.
        if (!identityBinder.isAttached(client.getSessionId())) {
            callSessionManager.leave(roomKey, connectionId);
        }
    }

    private ConnectionIdentity identityOf(SocketIOClient client) {
        return identityBinder.identityOf(client.getSessionId());
    }

    private <T> void validate(String event, Class<T> payloadType, T payload) {
        FailureReason reason = JOIN_EVENTS.contains(event) ? FailureReason.MISSING_DATA : FailureReason.VALIDATION_ERROR;
        if (payload == null) {
            if (payloadType == Object.class) {
                return;
            }
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Payload is required", reason);
        }
        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new ServiceException(HttpStatus.BAD_REQUEST, message, reason);
        }
    }

    private void fail(String event, SocketIOClient client, AckRequest ackRequest, FailureReason reason, String message) {
        switch (event) {
            case VERIFY_ROOM_CODE -> ack(ackRequest, (Object) null);
            case JOIN_ROOM_AUTHENTICATED -> ack(ackRequest, Map.of(
                    "ok", false,
                    "error", reason.name().toLowerCase(Locale.ROOT)));
            case DELETE_MESSAGE -> ack(ackRequest, Map.of(
                    "ok", false,
                    "error", reason.name()));
            default -> {
                Map<String, Object> payload = new LinkedHashMap<>();
                String failureEvent = FAILURE_EVENTS.get(event);
                if (failureEvent == null) {
                    failureEvent = ERROR_EVENT;
                    payload.put("event", event);
                }
                payload.put("reason", reason.name());
                payload.put("message", message);
                client.sendEvent(failureEvent, payload);
            }
        }
    }

    private static void ack(AckRequest ackRequest, Object data) {
        if (ackRequest != null && ackRequest.isAckRequested()) {
            ackRequest.sendAckData(data);
        }
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private static String firstText(String first, String second, String fallback) {
        if (StringUtils.hasText(first)) {
            return first;
        }
        return StringUtils.hasText(second) ? second : fallback;
    }

    @PreDestroy
    public void shutdown() {
        registeredEvents.forEach(socketIOServer::removeAllListeners);
    }
}
