package com.example.roomchat.call;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CallSessionManagerTest {

    private static final String ROOM = "room-1";

    private final List<CallEvent> events = new ArrayList<>();
    private CallSessionManager manager;

    @BeforeEach
    void setUp() {
        CallEventListener recorder = event -> {
            synchronized (events) {
                events.add(event);
            }
        };
        manager = new CallSessionManager(List.of(recorder));
    }

    @Test
    void secondJoinerSeesFirstAsExistingPeer() {
        manager.join(ROOM, "conn-a", "A");
        manager.join(ROOM, "conn-b", "B");

        CallEvent firstPeers = events.get(1);
        assertEquals(CallEventType.EXISTING_PEERS, firstPeers.getType());
        assertEquals("conn-a", firstPeers.getConnectionId());
        assertEquals(List.of(), firstPeers.getPayload().get("peers"));

        CallEvent secondPeers = eventsOf(CallEventType.EXISTING_PEERS).get(1);
        assertEquals("conn-b", secondPeers.getConnectionId());
        assertEquals(List.of(new CallPeer("conn-a", "A")), secondPeers.getPayload().get("peers"));
        assertEquals(2, secondPeers.getPayload().get("participantCount"));

        CallEvent joined = eventsOf(CallEventType.USER_JOINED_CALL).get(1);
        assertEquals("conn-b", joined.getConnectionId());
        assertEquals(Map.of("peerId", "conn-b", "name", "B", "participantCount", 2), joined.getPayload());
    }

    @Test
    void callStartedOnlyOncePerSession() {
        manager.join(ROOM, "conn-a", "A");
        manager.join(ROOM, "conn-b", "B");
        manager.join(ROOM, "conn-a", "A again");

        List<CallEvent> started = eventsOf(CallEventType.CALL_STARTED);
        assertEquals(1, started.size());
        assertEquals("A", started.get(0).getPayload().get("startedBy"));
        assertEquals(2, manager.participantCount(ROOM));
        assertEquals("A again", manager.find(ROOM).orElseThrow().getParticipants().get("conn-a"));
    }

    @Test
    void blankDisplayNameFallsBackToDefault() {
        manager.join(ROOM, "conn-a", " ");

        assertEquals(CallSessionManager.DEFAULT_DISPLAY_NAME, manager.find(ROOM).orElseThrow().getStartedBy());
    }

    @Test
    void lastLeaveEndsCallExactlyOnce() {
        manager.join(ROOM, "conn-a", "A");
        manager.join(ROOM, "conn-b", "B");

        assertTrue(manager.leave(ROOM, "conn-a"));
        assertTrue(manager.isActive(ROOM));
        assertTrue(manager.leave(ROOM, "conn-b"));
        assertFalse(manager.leave(ROOM, "conn-b"));

        assertFalse(manager.isActive(ROOM));
        assertEquals(2, eventsOf(CallEventType.USER_LEFT_CALL).size());
        List<CallEvent> ended = eventsOf(CallEventType.CALL_ENDED);
        assertEquals(1, ended.size());
        assertEquals(ROOM, ended.get(0).getPayload().get("roomId"));
        assertEquals(2, ended.get(0).getPayload().get("maxParticipants"));
    }

    @Test
    void leaveOfNonParticipantIsNoOp() {
        manager.join(ROOM, "conn-a", "A");
        events.clear();

        assertFalse(manager.leave(ROOM, "conn-x"));
        assertFalse(manager.leave("other-room", "conn-a"));

        assertTrue(events.isEmpty());
        assertEquals(1, manager.participantCount(ROOM));
    }

    @Test
    void disconnectLeavesEveryCall() {
        manager.join("room-1", "conn-a", "A");
        manager.join("room-2", "conn-a", "A");
        manager.join("room-2", "conn-b", "B");

        List<String> left = manager.disconnect("conn-a");

        assertEquals(2, left.size());
        assertTrue(left.containsAll(List.of("room-1", "room-2")));
        assertFalse(manager.isActive("room-1"));
        assertTrue(manager.isActive("room-2"));
        assertEquals(1, manager.participantCount("room-2"));
    }

    @Test
    void failingListenerDoesNotBreakStateTransitions() {
        CallSessionManager fragile = new CallSessionManager(List.of(event -> {
            throw new IllegalStateException("socket gone");
        }));

        fragile.join(ROOM, "conn-a", "A");
        fragile.leave(ROOM, "conn-a");

        assertFalse(fragile.isActive(ROOM));
    }

    @Test
    void sessionExistsExactlyWhileParticipantsRemain() throws InterruptedException {
        int connections = 16;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(connections);
        for (int i = 0; i < connections; i++) {
            String connectionId = "conn-" + i;
            pool.execute(() -> {
                try {
                    for (int round = 0; round < 50; round++) {
                        manager.join(ROOM, connectionId, connectionId);
                        manager.leave(ROOM, connectionId);
                    }
                } finally {
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();

        assertFalse(manager.isActive(ROOM));
        assertEquals(0, manager.participantCount(ROOM));
        assertEquals(eventsOf(CallEventType.CALL_STARTED).size(), eventsOf(CallEventType.CALL_ENDED).size());
    }

    @Test
    void findReturnsDetachedCopy() {
        manager.join(ROOM, "conn-a", "A");
        CallSession snapshot = manager.find(ROOM).orElseThrow();

        manager.join(ROOM, "conn-b", "B");

        assertEquals(1, snapshot.participantCount());
        assertEquals(2, manager.participantCount(ROOM));
    }

    private List<CallEvent> eventsOf(CallEventType type) {
        synchronized (events) {
            return events.stream().filter(event -> event.getType() == type).toList();
        }
    }
}
