package com.example.roomchat.call;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Owns the table of active calls keyed by room. A session exists exactly while it has at least
 * one participant: it is created by the first {@link #join} and removed, together with a single
 * {@code call_ended} notification, by the {@link #leave} or {@link #disconnect} that empties it.
 *
 * <p>All state transitions happen under one lock. Notifications are handed to the listeners while
 * the lock is still held so that clients observe them in transition order (a {@code call_ended}
 * can never overtake the {@code call_started} of the next session). Listeners must therefore only
 * enqueue non-blocking socket writes.
 */
@Slf4j
@Service
public class CallSessionManager {

    static final String DEFAULT_DISPLAY_NAME = "User";

    private final List<CallEventListener> listeners;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CallSession> sessions = new HashMap<>();

    public CallSessionManager(List<CallEventListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    public void join(String roomKey, String connectionId, String displayName) {
        String name = StringUtils.hasText(displayName) ? displayName : DEFAULT_DISPLAY_NAME;
        lock.lock();
        try {
            CallSession session = sessions.get(roomKey);
            if (session == null) {
                session = new CallSession(roomKey, name, Instant.now());
                sessions.put(roomKey, session);
                log.info("Call started in room {} by {}", roomKey, name);
                emit(CallEventType.CALL_STARTED, roomKey, connectionId, payload(
                        "roomId", roomKey,
                        "startedBy", name));
            }

            session.putParticipant(connectionId, name);
            int participantCount = session.participantCount();

            emit(CallEventType.EXISTING_PEERS, roomKey, connectionId, payload(
                    "roomId", roomKey,
                    "peers", session.peersExcluding(connectionId),
                    "participantCount", participantCount));
            emit(CallEventType.USER_JOINED_CALL, roomKey, connectionId, payload(
                    "peerId", connectionId,
                    "name", name,
                    "participantCount", participantCount));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the connection from the room's call.
     *
     * @return {@code true} if the connection was a participant
     */
    public boolean leave(String roomKey, String connectionId) {
        lock.lock();
        try {
            return leaveLocked(roomKey, connectionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the connection from every call it participates in.
     *
     * @return the room keys whose calls the connection left
     */
    public List<String> disconnect(String connectionId) {
        lock.lock();
        try {
            List<String> joined = sessions.values().stream()
                    .filter(session -> session.hasParticipant(connectionId))
                    .map(CallSession::getRoomKey)
                    .toList();
            List<String> left = new ArrayList<>(joined.size());
            for (String roomKey : joined) {
                if (leaveLocked(roomKey, connectionId)) {
                    left.add(roomKey);
                }
            }
            return left;
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive(String roomKey) {
        lock.lock();
        try {
            return sessions.containsKey(roomKey);
        } finally {
            lock.unlock();
        }
    }

    public int participantCount(String roomKey) {
        lock.lock();
        try {
            CallSession session = sessions.get(roomKey);
            return session == null ? 0 : session.participantCount();
        } finally {
            lock.unlock();
        }
    }

    public Optional<CallSession> find(String roomKey) {
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(roomKey)).map(CallSession::copy);
        } finally {
            lock.unlock();
        }
    }

    private boolean leaveLocked(String roomKey, String connectionId) {
        CallSession session = sessions.get(roomKey);
        if (session == null || !session.hasParticipant(connectionId)) {
            return false;
        }

        String name = session.removeParticipant(connectionId);
        int participantCount = session.participantCount();
        emit(CallEventType.USER_LEFT_CALL, roomKey, connectionId, payload(
                "peerId", connectionId,
                "name", name,
                "participantCount", participantCount));

        if (session.isEmpty()) {
            sessions.remove(roomKey);
            Duration duration = Duration.between(session.getStartedAt(), Instant.now());
            log.info("Call in room {} ended after {}s, peak {} participant(s)",
                    roomKey, duration.toSeconds(), session.getMaxParticipants());
            emit(CallEventType.CALL_ENDED, roomKey, null, payload(
                    "roomId", roomKey,
                    "maxParticipants", session.getMaxParticipants(),
                    "durationSeconds", duration.toSeconds()));
        }
        return true;
    }

    private void emit(CallEventType type, String roomKey, String connectionId, Map<String, Object> payload) {
        CallEvent event = CallEvent.builder()
                .type(type)
                .roomKey(roomKey)
                .connectionId(connectionId)
                .payload(payload)
                .build();
        for (CallEventListener listener : listeners) {
            try {
                listener.onCallEvent(event);
            } catch (RuntimeException ex) {
                log.warn("Call listener {} failed on {} for room {}",
                        listener.getClass().getSimpleName(), type, roomKey, ex);
            }
        }
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            payload.put((String) keyValues[i], keyValues[i + 1]);
        }
        return payload;
    }
}
