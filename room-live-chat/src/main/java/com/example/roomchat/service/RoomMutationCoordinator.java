package com.example.roomchat.service;

import com.example.roomchat.config.ChatProperties;
import com.example.roomchat.domain.ConnectionIdentity;
import com.example.roomchat.domain.MemberRole;
import com.example.roomchat.domain.Room;
import com.example.roomchat.domain.RoomMember;
import com.example.roomchat.dto.ChangeThemeRequest;
import com.example.roomchat.dto.CreateRoomRequest;
import com.example.roomchat.dto.JoinRoomRequest;
import com.example.roomchat.event.ChatEventPublisher;
import com.example.roomchat.event.ChatEventType;
import com.example.roomchat.service.exception.FailureReason;
import com.example.roomchat.service.exception.ServiceException;
import com.example.roomchat.websocket.BroadcastHub;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Room lifecycle: creation under the per-owner limit, owner-only rename, delete and AI toggle,
 * joins by code and theme changes. Each successful mutation is fanned out through
 * {@link BroadcastHub} after the lock protecting it has been released.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomMutationCoordinator {

    public static final String AI_TOGGLED_EVENT = "room_ai_toggled";
    public static final String THEME_CHANGED_EVENT = "room_theme_changed";
    public static final String ROOM_JOINED_EVENT = "room_joined";

    static final int MAX_MEMBER_NAME_LENGTH = 64;

    private final RoomStore roomStore;
    private final MessageStore messageStore;
    private final ChatLockService lockService;
    private final BroadcastHub broadcastHub;
    private final ChatEventPublisher eventPublisher;
    private final ChatProperties chatProperties;

    public Room create(ConnectionIdentity requester, CreateRoomRequest request) {
        String ownerId = StringUtils.hasText(request.getOwnerId())
                ? request.getOwnerId().trim()
                : requester.preferredOwnerId();
        if (ownerId == null) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Owner email is required.", FailureReason.MISSING_OWNER);
        }

        int maxPerOwner = chatProperties.getRooms().getMaxPerOwner();
        Room created = lockService.withOwnerLock(ownerId, () -> {
            if (roomStore.countByOwner(ownerId) >= maxPerOwner) {
                throw new ServiceException(HttpStatus.TOO_MANY_REQUESTS,
                        "You can only create up to " + maxPerOwner + " rooms.", FailureReason.LIMIT_REACHED);
            }
            Instant now = Instant.now();
            List<RoomMember> members = new ArrayList<>();
            members.add(RoomMember.builder()
                    .id(ownerId)
                    .name(StringUtils.hasText(request.getOwnerName()) ? request.getOwnerName() : ownerId)
                    .role(MemberRole.OWNER)
                    .build());
            Room room = Room.builder()
                    .name(request.getName().trim())
                    .ownerId(ownerId)
                    .code(uniqueCode())
                    .inviteLinkId(RandomTokens.inviteLinkId())
                    .allowAI(request.getAllowAI() == null || request.getAllowAI())
                    .members(members)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            return roomStore.create(room);
        });

        log.info("Room {} created by {} with code {}", created.getId(), ownerId, created.getCode());
        eventPublisher.publish(ChatEventType.ROOM_CREATED, created.getId(), ownerId,
                Map.of("name", created.getName(), "code", created.getCode()));
        broadcastHub.broadcastRoomList();
        return created;
    }

    public Room rename(String roomId, String newName, ConnectionIdentity requester) {
        requireOwner(loadRoom(roomId), requester, "rename_room");
        Room renamed = lockService.withRoomLock(roomId, () -> {
            Room room = loadRoom(roomId);
            room.setName(newName.trim());
            room.setUpdatedAt(Instant.now());
            return roomStore.update(room);
        });

        log.info("Room {} renamed to '{}'", roomId, renamed.getName());
        eventPublisher.publish(ChatEventType.ROOM_RENAMED, roomId, requester.preferredOwnerId(),
                Map.of("name", renamed.getName()));
        broadcastHub.broadcastRoomList();
        return renamed;
    }

    public void delete(String roomId, ConnectionIdentity requester) {
        requireOwner(loadRoom(roomId), requester, "delete_room");
        lockService.withRoomLock(roomId, () -> {
            messageStore.deleteByRoom(roomId);
            roomStore.delete(roomId);
            return null;
        });

        log.info("Room {} deleted", roomId);
        eventPublisher.publish(ChatEventType.ROOM_DELETED, roomId, requester.preferredOwnerId(), Map.of());
        broadcastHub.broadcastRoomList();
    }

    /**
     * Flips the AI flag of a room owned by the requester.
     *
     * @return the updated room, or empty when the room does not exist
     */
    public Optional<Room> toggleAI(String roomId, ConnectionIdentity requester) {
        Optional<Room> existing = roomStore.findById(roomId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        requireOwner(existing.get(), requester, "toggle_room_ai");

        Optional<Room> toggled = lockService.withRoomLock(roomId, () -> roomStore.findById(roomId).map(room -> {
            room.setAllowAI(!room.isAllowAI());
            room.setUpdatedAt(Instant.now());
            return roomStore.update(room);
        }));

        toggled.ifPresent(room -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("roomId", roomId);
            payload.put("allowAI", room.isAllowAI());
            broadcastHub.toRoom(roomId, AI_TOGGLED_EVENT, payload);
            eventPublisher.publish(ChatEventType.ROOM_AI_TOGGLED, roomId, requester.preferredOwnerId(),
                    Map.of("allowAI", room.isAllowAI()));
        });
        return toggled;
    }

    /**
     * Adds {@code candidate} to the room with the given code unless one of {@code knownIds} is
     * already a member. Repeated joins with the same id leave the member list unchanged.
     */
    public JoinResult joinByCode(String code, RoomMember candidate, Collection<String> knownIds) {
        Room found = roomStore.findByCode(code).orElseThrow(ServiceException::roomNotFound);

        JoinResult result = lockService.withRoomLock(found.getId(), () -> {
            Room room = loadRoom(found.getId());
            boolean added = !room.hasAnyMember(knownIds) && room.addMemberIfAbsent(candidate);
            boolean changed = added;
            if (!StringUtils.hasText(room.getInviteLinkId())) {
                room.setInviteLinkId(RandomTokens.inviteLinkId());
                changed = true;
            }
            if (changed) {
                room.setUpdatedAt(Instant.now());
                room = roomStore.update(room);
            }
            return new JoinResult(room, added);
        });

        if (result.isNewMember()) {
            log.info("{} {} joined room {}", candidate.getRole().value(), candidate.getId(), found.getId());
            eventPublisher.publish(ChatEventType.MEMBER_JOINED, found.getId(), candidate.getId(),
                    Map.of("role", candidate.getRole().value()));
        }
        return result;
    }

    /**
     * Code join for clients that are not connected over Socket.IO yet. The joiner is added as a
     * member; connected members of the room learn about it and every room list is refreshed.
     */
    public Room joinAsMember(JoinRoomRequest request) {
        String memberId = StringUtils.hasText(request.getUserId())
                ? request.getUserId().trim()
                : RandomTokens.guestId();
        String name = StringUtils.hasText(request.getUserName()) ? request.getUserName().trim() : "Guest";
        if (name.length() > MAX_MEMBER_NAME_LENGTH) {
            name = name.substring(0, MAX_MEMBER_NAME_LENGTH);
        }
        RoomMember candidate = RoomMember.builder().id(memberId).name(name).role(MemberRole.MEMBER).build();

        Room room = joinByCode(request.getCode().trim(), candidate, List.of(memberId)).getRoom();

        Map<String, Object> joinedUser = new LinkedHashMap<>();
        joinedUser.put("id", memberId);
        joinedUser.put("name", name);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("room", room);
        payload.put("joinedUser", joinedUser);
        broadcastHub.toRoom(room.getId(), ROOM_JOINED_EVENT, payload);
        broadcastHub.broadcastRoomList();
        return room;
    }

    public Optional<Room> verifyCode(String code) {
        if (!StringUtils.hasText(code)) {
            return Optional.empty();
        }
        return roomStore.findByCode(code.trim());
    }

    /**
     * Stores the theme when the room exists and tells the room about the change either way.
     */
    public void changeTheme(ChangeThemeRequest request) {
        String roomId = request.getRoomId();
        String theme = request.getTheme();
        lockService.withRoomLock(roomId, () -> roomStore.findById(roomId).map(room -> {
            room.setTheme(theme);
            room.setUpdatedAt(Instant.now());
            return roomStore.update(room);
        }));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("roomId", roomId);
        payload.put("theme", theme);
        payload.put("changedBy", request.getChangedBy());
        broadcastHub.toRoom(roomId, THEME_CHANGED_EVENT, payload);

        String actor = StringUtils.hasText(request.getChangedBy()) ? request.getChangedBy() : "Someone";
        broadcastHub.systemMessage(roomId, actor + " changed the room theme to \"" + theme + "\"", null);
    }

    /**
     * Deletes rooms created before {@code cutoff} together with their messages.
     *
     * @return number of rooms removed
     */
    public int purgeExpired(Instant cutoff) {
        List<Room> expired = roomStore.findCreatedBefore(cutoff);
        int purged = 0;
        for (Room room : expired) {
            try {
                lockService.withRoomLock(room.getId(), () -> {
                    messageStore.deleteByRoom(room.getId());
                    roomStore.delete(room.getId());
                    return null;
                });
                purged++;
                eventPublisher.publish(ChatEventType.ROOM_EXPIRED, room.getId(), null,
                        Map.of("createdAt", String.valueOf(room.getCreatedAt())));
            } catch (RuntimeException ex) {
                log.warn("Failed to purge expired room {}", room.getId(), ex);
            }
        }
        if (purged > 0) {
            log.info("Purged {} room(s) created before {}", purged, cutoff);
            broadcastHub.broadcastRoomList();
        }
        return purged;
    }

    private Room loadRoom(String roomId) {
        return roomStore.findById(roomId).orElseThrow(ServiceException::roomNotFound);
    }

    private void requireOwner(Room room, ConnectionIdentity requester, String action) {
        if (VisibilityFilter.isOwner(room, requester)) {
            return;
        }
        log.warn("Denied {} on room {} for {}", action, room.getId(), requester);
        eventPublisher.authorizationDenied(room.getId(), requester.preferredOwnerId(), action);
        throw new ServiceException(HttpStatus.FORBIDDEN,
                "Only the room owner can do that.", FailureReason.NOT_OWNER);
    }

    private String uniqueCode() {
        int attempts = chatProperties.getRooms().getCodeAttempts();
        for (int i = 0; i < attempts; i++) {
            String code = RandomTokens.roomCode();
            if (roomStore.findByCode(code).isEmpty()) {
                return code;
            }
        }
        throw ServiceException.serverError("Could not allocate a unique room code.", null);
    }

    @Value
    public static class JoinResult {
        Room room;
        boolean newMember;
    }
}
