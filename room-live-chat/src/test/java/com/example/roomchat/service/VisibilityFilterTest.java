package com.example.roomchat.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.roomchat.domain.ConnectionIdentity;
import com.example.roomchat.domain.MemberRole;
import com.example.roomchat.domain.Room;
import com.example.roomchat.domain.RoomMember;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class VisibilityFilterTest {

    private final Room ownedByEmail = room("r1", "owner@example.com");
    private final Room ownedById = room("r2", "user-42");
    private final Room withGuest = room("r3", "someone@example.com",
            RoomMember.builder().id("guest_abc12345").name("Guest").role(MemberRole.GUEST).build());
    private final Room withMemberEmail = room("r4", "someone@example.com",
            RoomMember.builder().id("member@example.com").name("Member").role(MemberRole.MEMBER).build());
    private final List<Room> rooms = List.of(ownedByEmail, ownedById, withGuest, withMemberEmail);

    @Test
    void anonymousIdentitySeesNothing() {
        assertTrue(VisibilityFilter.visible(rooms, ConnectionIdentity.anonymous()).isEmpty());
    }

    @Test
    void ownerMatchesByEmailOrUserId() {
        assertEquals(List.of(ownedByEmail), VisibilityFilter.visible(rooms, ConnectionIdentity.of(null, "owner@example.com")));
        assertEquals(List.of(ownedById), VisibilityFilter.visible(rooms, ConnectionIdentity.of("user-42", null)));
    }

    @Test
    void membersMatchByUserIdOrEmail() {
        assertEquals(List.of(withGuest), VisibilityFilter.visible(rooms, ConnectionIdentity.of("guest_abc12345", null)));
        assertEquals(List.of(withMemberEmail),
                VisibilityFilter.visible(rooms, ConnectionIdentity.of("unrelated", "member@example.com")));
    }

    @Test
    void keepsStoreOrder() {
        ConnectionIdentity both = ConnectionIdentity.of("user-42", "owner@example.com");

        assertEquals(List.of(ownedByEmail, ownedById), VisibilityFilter.visible(rooms, both));
    }

    @Test
    void ownerCheckIgnoresMembership() {
        ConnectionIdentity guest = ConnectionIdentity.of("guest_abc12345", null);

        assertTrue(VisibilityFilter.isVisible(withGuest, guest));
        assertFalse(VisibilityFilter.isOwner(withGuest, guest));
    }

    private static Room room(String id, String ownerId, RoomMember... members) {
        return Room.builder()
                .id(id)
                .name(id)
                .ownerId(ownerId)
                .members(new ArrayList<>(List.of(members)))
                .build();
    }
}
