package com.example.roomchat.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

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
import com.example.roomchat.service.exception.FailureReason;
import com.example.roomchat.service.exception.ServiceException;
import com.example.roomchat.websocket.BroadcastHub;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

@ExtendWith(MockitoExtension.class)
class MessageCoordinatorTest {

    private static final String OWNER_EMAIL = "owner@example.com";

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RLock lock;

    @Mock
    private BroadcastHub broadcastHub;

    @Mock
    private ChatEventPublisher eventPublisher;

    private final ChatProperties chatProperties = new ChatProperties();
    private final InMemoryRoomStore roomStore = new InMemoryRoomStore();
    private final InMemoryMessageStore messageStore = new InMemoryMessageStore();
    private MessageCoordinator coordinator;
    private Room room;

    @BeforeEach
    void setUp() {
        lenient().when(redissonClient.getLock(anyString())).thenReturn(lock);
        ChatLockService lockService = new ChatLockService(redissonClient, new RedisKeyFactory(chatProperties));
        coordinator = new MessageCoordinator(
                messageStore, roomStore, lockService, broadcastHub, eventPublisher, chatProperties);
        room = roomStore.create(Room.builder().name("Room").ownerId(OWNER_EMAIL).code("123456").build());
    }

    @Test
    void sendPersistsAndBroadcasts() {
        MessagePayload payload = coordinator.send(sendRequest("hello"));

        assertFalse(payload.isTemporary());
        assertEquals("hello", payload.getText());
        assertEquals(MessageRole.USER, payload.getRole());
        assertTrue(messageStore.contains(payload.getId()));
        verify(broadcastHub).toRoom(room.getId(), MessageCoordinator.RECEIVE_EVENT, payload);
    }

    @Test
    void sendDeliversTemporaryMessageWhenStoreFails() {
        messageStore.failWrites(true);
        Instant clientTime = Instant.parse("2024-05-01T10:15:30Z");
        SendMessageRequest request = sendRequest("still delivered");
        request.setCreatedAt(clientTime);

        MessagePayload payload = coordinator.send(request);

        assertTrue(payload.isTemporary());
        assertTrue(payload.getId().startsWith(MessagePayload.TEMPORARY_ID_PREFIX));
        assertEquals(clientTime, payload.getCreatedAt());
        assertEquals("still delivered", payload.getText());
        verify(broadcastHub).toRoom(room.getId(), MessageCoordinator.RECEIVE_EVENT, payload);
    }

    @Test
    void senderMayDeleteOwnMessage() {
        ChatMessage message = storeMessage("m1", "u1", null);

        coordinator.delete(deleteRequest(message.getId()), ConnectionIdentity.of("u1", null));

        assertFalse(messageStore.contains("m1"));
        verify(broadcastHub).toRoom(room.getId(), MessageCoordinator.DELETED_EVENT, Map.of("messageId", "m1"));
    }

    @Test
    void requesterSuppliedUserIdIsAccepted() {
        storeMessage("m1", "u1", null);
        DeleteMessageRequest request = deleteRequest("m1");
        request.setRequesterUserId("u1");

        coordinator.delete(request, ConnectionIdentity.anonymous());

        assertFalse(messageStore.contains("m1"));
    }

    @Test
    void roomOwnerMayDeleteAnyMessage() {
        storeMessage("m1", "someone-else", null);

        coordinator.delete(deleteRequest("m1"), ConnectionIdentity.of(null, OWNER_EMAIL));

        assertFalse(messageStore.contains("m1"));
    }

    @Test
    void matchingGuestNameIsEnoughToDelete() {
        storeMessage("m1", null, "Ana");
        DeleteMessageRequest request = deleteRequest("m1");
        request.setRequesterGuestName("Ana");

        coordinator.delete(request, ConnectionIdentity.of("guest_other", null));

        assertFalse(messageStore.contains("m1"));
    }

    @Test
    void unrelatedRequesterIsRejected() {
        storeMessage("m1", "u1", "Ana");
        DeleteMessageRequest request = deleteRequest("m1");
        request.setRequesterGuestName("Bob");

        ServiceException ex = assertThrows(ServiceException.class,
                () -> coordinator.delete(request, ConnectionIdentity.of("u2", "u2@example.com")));

        assertEquals(FailureReason.NOT_AUTHORIZED, ex.getReason());
        assertTrue(messageStore.contains("m1"));
        verify(eventPublisher).authorizationDenied(room.getId(), "u2@example.com", "delete_message");
        verify(broadcastHub, never()).toRoom(anyString(), eq(MessageCoordinator.DELETED_EVENT), any());
    }

    @Test
    void ownerCheckFailsAsServerErrorWhenRoomStoreIsDown() {
        storeMessage("m1", "someone-else", null);
        roomStore.failReads(true);

        ServiceException ex = assertThrows(ServiceException.class,
                () -> coordinator.delete(deleteRequest("m1"), ConnectionIdentity.of(null, OWNER_EMAIL)));

        assertEquals(FailureReason.SERVER_ERROR, ex.getReason());
        assertTrue(messageStore.contains("m1"));
        verify(eventPublisher, never()).authorizationDenied(anyString(), anyString(), anyString());
    }

    @Test
    void senderDeletesWithoutRoomLookup() {
        storeMessage("m1", "u1", null);
        roomStore.failReads(true);

        coordinator.delete(deleteRequest("m1"), ConnectionIdentity.of("u1", null));

        assertFalse(messageStore.contains("m1"));
    }

    @Test
    void deletingMissingMessageFails() {
        ServiceException ex = assertThrows(ServiceException.class,
                () -> coordinator.delete(deleteRequest("missing"), ConnectionIdentity.of("u1", null)));

        assertEquals(FailureReason.MESSAGE_NOT_FOUND, ex.getReason());
    }

    @Test
    void deletionFallsBackToRequestRoom() {
        messageStore.put(ChatMessage.builder().id("orphan").senderUserId("u1").createdAt(Instant.now()).build());
        DeleteMessageRequest request = deleteRequest("orphan");
        request.setRoomId("fallback-room");

        String announcedTo = coordinator.delete(request, ConnectionIdentity.of("u1", null));

        assertEquals("fallback-room", announcedTo);
        verify(broadcastHub).toRoom("fallback-room", MessageCoordinator.DELETED_EVENT, Map.of("messageId", "orphan"));
    }

    @Test
    void reactionToggleBroadcastsCurrentReactions() {
        storeMessage("m1", "u1", null);
        ReactionRequest request = new ReactionRequest();
        request.setMessageId("m1");
        request.setEmoji("👍");
        request.setUserId("u2");
        request.setDisplayName("Two");

        List<Reaction> added = coordinator.toggleReaction(request);
        List<Reaction> removed = coordinator.toggleReaction(request);

        assertEquals(1, added.size());
        assertTrue(removed.isEmpty());
        assertTrue(messageStore.findById("m1").orElseThrow().getReactions().isEmpty());
        verify(broadcastHub).toRoom(room.getId(), MessageCoordinator.REACTION_EVENT,
                Map.of("messageId", "m1", "reactions", added));
    }

    @Test
    void reactionOnMissingMessageFails() {
        ReactionRequest request = new ReactionRequest();
        request.setMessageId("missing");
        request.setEmoji("👍");
        request.setUserId("u2");

        ServiceException ex = assertThrows(ServiceException.class, () -> coordinator.toggleReaction(request));

        assertEquals(FailureReason.MESSAGE_NOT_FOUND, ex.getReason());
        verify(lock).unlock();
    }

    @Test
    void historyIsCappedAndChronological() {
        chatProperties.getMessages().setHistoryLimit(3);
        Instant base = Instant.parse("2024-05-01T10:00:00Z");
        for (int i = 0; i < 5; i++) {
            messageStore.put(ChatMessage.builder()
                    .id("m" + i)
                    .roomId(room.getId())
                    .content("message " + i)
                    .createdAt(base.plusSeconds(i))
                    .build());
        }

        List<MessagePayload> history = coordinator.history(room.getId(), 50);

        assertEquals(List.of("m2", "m3", "m4"), history.stream().map(MessagePayload::getId).toList());
    }

    private SendMessageRequest sendRequest(String text) {
        SendMessageRequest request = new SendMessageRequest();
        request.setRoomId(room.getId());
        request.setText(text);
        request.setSenderUserId("u1");
        return request;
    }

    private ChatMessage storeMessage(String id, String senderUserId, String senderGuestName) {
        return messageStore.put(ChatMessage.builder()
                .id(id)
                .roomId(room.getId())
                .senderUserId(senderUserId)
                .senderGuestName(senderGuestName)
                .content("text")
                .createdAt(Instant.now())
                .build());
    }

    private static DeleteMessageRequest deleteRequest(String messageId) {
        DeleteMessageRequest request = new DeleteMessageRequest();
        request.setMessageId(messageId);
        return request;
    }
}
