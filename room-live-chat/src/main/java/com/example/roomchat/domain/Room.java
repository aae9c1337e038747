package com.example.roomchat.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Room implements Serializable {

    public static final String DEFAULT_THEME = "default";

    private String id;
    private String name;
    private String ownerId;
    private String code;
    private String inviteLinkId;
    private boolean allowAI;

    @Builder.Default
    private List<RoomMember> members = new ArrayList<>();

    @Builder.Default
    private String theme = DEFAULT_THEME;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Returns {@code true} when any of the given identifiers is already listed as a member id.
     */
    public boolean hasAnyMember(Collection<String> memberIds) {
        if (members == null || memberIds == null) {
            return false;
        }
        return members.stream()
                .map(RoomMember::getId)
                .anyMatch(memberIds::contains);
    }

    /**
     * Appends the member unless a member with the same id exists.
     *
     * @return {@code true} if the member list changed
     */
    public boolean addMemberIfAbsent(RoomMember member) {
        if (members == null) {
            members = new ArrayList<>();
        }
        boolean present = members.stream().anyMatch(existing -> existing.getId().equals(member.getId()));
        if (present) {
            return false;
        }
        members.add(member);
        return true;
    }
}
