package com.example.roomchat.service;

import com.example.roomchat.config.ChatProperties;
import com.example.roomchat.domain.ChatMessage;
import com.example.roomchat.domain.ConnectionIdentity;
import com.example.roomchat.domain.MessageRole;
import com.example.roomchat.domain.Reaction;
import com.example.roomchat.domain.Room;
import com.example.roomchat.dto.DeleteMessageRequest;
import com.example.roomchat.dto.MessagePayload;
import com.example.roomchat.dto.ReactionRequest;
import com.example.roomchat.dto.SendMessageRequest;
import com.example.roomchat.event.ChatEventPublisher;
import com.example.roomchat.event.ChatEventType;
import com.example.roomchat.service.exception.FailureReason;
import com.example.roomchat.service.exception.ServiceException;
import com.example.roomchat.websocket.BroadcastHub;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class MessageCoordinator {

    public static final String RECEIVE_EVENT = "receive_message";
    public static final String DELETED_EVENT = "message_deleted";
    public static final String REACTION_EVENT = "reactionUpdated";

    private final MessageStore messageStore;
    private final RoomStore roomStore;
    private final ChatLockService lockService;
    private final BroadcastHub broadcastHub;
    private final ChatEventPublisher eventPublisher;
    private final ChatProperties chatProperties;

    /**
     * Persists and broadcasts a message. When the store is unavailable the room still receives
     * the message under a {@code temp-} id; nothing is reported back to the sender.
     */
    public MessagePayload send(SendMessageRequest request) {
        String roomId = request.getRoomId();
        ChatMessage draft = ChatMessage.builder()
                .roomId(roomId)
                .senderUserId(emptyToNull(request.getSenderUserId()))
                .senderGuestName(emptyToNull(request.getSenderGuestName()))
                .role(MessageRole.fromValue(request.getRole()))
                .content(request.getText() == null ? "" : request.getText())
                .mediaUrl(emptyToNull(request.getMediaUrl()))
                .mediaType(emptyToNull(request.getMediaType()))
                .mediaName(emptyToNull(request.getMediaName()))
                .mimeType(emptyToNull(request.getMimeType()))
                .build();

        MessagePayload payload;
        try {
            payload = MessagePayload.from(messageStore.create(draft));
        } catch (RuntimeException ex) {
            log.warn("Message for room {} not persisted, delivering unsaved copy: {}", roomId, ex.getMessage());
            draft.setId(MessagePayload.TEMPORARY_ID_PREFIX + UUID.randomUUID());
            draft.setCreatedAt(request.getCreatedAt() != null ? request.getCreatedAt() : Instant.now());
            payload = MessagePayload.from(draft);
        }

        broadcastHub.toRoom(roomId, RECEIVE_EVENT, payload);
        return payload;
    }

    /**
     * Deletes a message if the requester sent it or owns its room.
     *
     * @return the room the deletion was announced to, or {@code null} when unknown
     */
    public String delete(DeleteMessageRequest request, ConnectionIdentity requester) {
        String messageId = request.getMessageId();
        ChatMessage message = messageStore.findById(messageId).orElseThrow(ServiceException::messageNotFound);

        if (!isAllowedToDelete(message, request, requester)) {
            log.warn("Denied delete of message {} in room {} for {}", messageId, message.getRoomId(), requester);
            eventPublisher.authorizationDenied(message.getRoomId(), requester.preferredOwnerId(), "delete_message");
            throw new ServiceException(HttpStatus.FORBIDDEN,
                    "Not allowed to delete this message.", FailureReason.NOT_AUTHORIZED);
        }

        messageStore.delete(messageId);
        String roomId = message.getRoomId() != null ? message.getRoomId() : emptyToNull(request.getRoomId());
        if (roomId != null) {
            broadcastHub.toRoom(roomId, DELETED_EVENT, Map.of("messageId", messageId));
        }
        eventPublisher.publish(ChatEventType.MESSAGE_DELETED, roomId, requester.preferredOwnerId(),
                Map.of("messageId", messageId));
        return roomId;
    }

    public List<Reaction> toggleReaction(ReactionRequest request) {
        String messageId = request.getMessageId();
        ChatMessage updated = lockService.withMessageLock(messageId, () -> {
            ChatMessage message = messageStore.findById(messageId).orElseThrow(ServiceException::messageNotFound);
            message.setReactions(Reactions.toggle(
                    message.getReactions(), request.getEmoji(), request.getUserId(), request.getDisplayName()));
            return messageStore.update(message);
        });

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("messageId", messageId);
        payload.put("reactions", updated.getReactions());
        broadcastHub.toRoom(updated.getRoomId(), REACTION_EVENT, payload);
        return updated.getReactions();
    }

    /** Most recent messages of a room in chronological order. */
    public List<MessagePayload> history(String roomId, Integer limit) {
        int max = chatProperties.getMessages().getHistoryLimit();
        int size = limit == null || limit <= 0 ? max : Math.min(limit, max);
        return messageStore.findByRoom(roomId, size).stream()
                .map(MessagePayload::from)
                .toList();
    }

    // A matching guest name is enough on its own; guest names are not bound to the connection.
    private boolean isAllowedToDelete(ChatMessage message, DeleteMessageRequest request, ConnectionIdentity requester) {
        String sender = message.getSenderUserId();
        if (sender != null && sender.equals(requester.getUserId())) {
            return true;
        }
        if (sender != null && sender.equals(request.getRequesterUserId())) {
            return true;
        }
        if (StringUtils.hasText(request.getRequesterGuestName())
                && Objects.equals(request.getRequesterGuestName(), message.getSenderGuestName())) {
            return true;
        }
        return findRoom(message.getRoomId()).map(room -> VisibilityFilter.isOwner(room, requester)).orElse(false);
    }

    /** Loads the room for the owner check; a store failure must not read as "not the owner". */
    private Optional<Room> findRoom(String roomId) {
        if (roomId == null) {
            return Optional.empty();
        }
        try {
            return roomStore.findById(roomId);
        } catch (RuntimeException ex) {
            throw ServiceException.serverError("Could not verify room ownership.", ex);
        }
    }

    private static String emptyToNull(String value) {
        return StringUtils.hasText(value) ? value : null;
    }
}
