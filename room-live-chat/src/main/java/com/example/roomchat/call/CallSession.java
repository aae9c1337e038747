package com.example.roomchat.call;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ephemeral record of an active call in one room. Instances held by {@link CallSessionManager}
 * are only touched under its lock; callers receive copies.
 */
public final class CallSession {

    private final String roomKey;
    private final String startedBy;
    private final Instant startedAt;
    private final Map<String, String> participants;
    private int maxParticipants;

    CallSession(String roomKey, String startedBy, Instant startedAt) {
        this(roomKey, startedBy, startedAt, new LinkedHashMap<>(), 0);
    }

    private CallSession(
            String roomKey,
            String startedBy,
            Instant startedAt,
            Map<String, String> participants,
            int maxParticipants) {
        this.roomKey = Objects.requireNonNull(roomKey, "roomKey");
        this.startedBy = startedBy;
        this.startedAt = startedAt;
        this.participants = participants;
        this.maxParticipants = maxParticipants;
    }

    void putParticipant(String connectionId, String displayName) {
        participants.put(connectionId, displayName);
        maxParticipants = Math.max(maxParticipants, participants.size());
    }

    String removeParticipant(String connectionId) {
        return participants.remove(connectionId);
    }

    CallSession copy() {
        return new CallSession(roomKey, startedBy, startedAt, new LinkedHashMap<>(participants), maxParticipants);
    }

    public boolean hasParticipant(String connectionId) {
        return participants.containsKey(connectionId);
    }

    public boolean isEmpty() {
        return participants.isEmpty();
    }

    public int participantCount() {
        return participants.size();
    }

    /** Participants other than {@code connectionId}, in join order. */
    public List<CallPeer> peersExcluding(String connectionId) {
        return participants.entrySet().stream()
                .filter(entry -> !entry.getKey().equals(connectionId))
                .map(entry -> new CallPeer(entry.getKey(), entry.getValue()))
                .toList();
    }

    public String getRoomKey() {
        return roomKey;
    }

    public String getStartedBy() {
        return startedBy;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public int getMaxParticipants() {
        return maxParticipants;
    }

    public Map<String, String> getParticipants() {
        return Map.copyOf(participants);
    }
}
