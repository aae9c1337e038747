package com.example.roomchat.service;

import com.example.roomchat.domain.Reaction;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reaction toggling with at most one reaction per user and message.
 */
public final class Reactions {

    static final String DEFAULT_DISPLAY_NAME = "Guest";

    private Reactions() {
    }

    /**
     * Same user and emoji removes the reaction. Otherwise any other reaction of the user is
     * dropped and the new one appended.
     */
    public static List<Reaction> toggle(List<Reaction> current, String emoji, String userId, String displayName) {
        List<Reaction> reactions = current == null ? new ArrayList<>() : new ArrayList<>(current);
        boolean removed = reactions.removeIf(reaction ->
                Objects.equals(reaction.getUserId(), userId) && Objects.equals(reaction.getEmoji(), emoji));
        if (removed) {
            return reactions;
        }
        reactions.removeIf(reaction -> Objects.equals(reaction.getUserId(), userId));
        reactions.add(Reaction.builder()
                .emoji(emoji)
                .userId(userId)
                .displayName(displayName == null || displayName.isBlank() ? DEFAULT_DISPLAY_NAME : displayName)
                .build());
        return reactions;
    }
}
