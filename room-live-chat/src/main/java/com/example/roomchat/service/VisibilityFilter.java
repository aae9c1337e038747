package com.example.roomchat.service;

import com.example.roomchat.domain.ConnectionIdentity;
import com.example.roomchat.domain.Room;
import com.example.roomchat.domain.RoomMember;
import java.util.List;
import java.util.Objects;

/**
 * Decides which persisted rooms an identity may see. Evaluated fresh on every delivery because
 * both room membership and connection identity change over a connection's life.
 */
public final class VisibilityFilter {

    private VisibilityFilter() {
    }

    public static List<Room> visible(List<Room> rooms, ConnectionIdentity identity) {
        if (rooms == null || identity == null || identity.isAnonymous()) {
            return List.of();
        }
        return rooms.stream()
                .filter(room -> isVisible(room, identity))
                .toList();
    }

    public static boolean isVisible(Room room, ConnectionIdentity identity) {
        if (isOwner(room, identity)) {
            return true;
        }
        List<RoomMember> members = room.getMembers() == null ? List.of() : room.getMembers();
        List<String> ids = identity.ids();
        return members.stream()
                .map(RoomMember::getId)
                .filter(Objects::nonNull)
                .anyMatch(ids::contains);
    }

    /** Owner match by email or by user id. */
    public static boolean isOwner(Room room, ConnectionIdentity identity) {
        if (room == null || identity == null || room.getOwnerId() == null) {
            return false;
        }
        return identity.ids().contains(room.getOwnerId());
    }
}
