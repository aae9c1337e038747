package com.example.roomchat.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.roomchat.domain.Reaction;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReactionsTest {

    private final List<Reaction> initial = List.of(
            Reaction.builder().emoji("👍").userId("u1").displayName("One").build(),
            Reaction.builder().emoji("🎉").userId("u2").displayName("Two").build());

    @Test
    void togglingTwiceRestoresOriginal() {
        List<Reaction> once = Reactions.toggle(initial, "❤️", "u3", "Three");
        List<Reaction> twice = Reactions.toggle(once, "❤️", "u3", "Three");

        assertEquals(3, once.size());
        assertEquals(initial, twice);
    }

    @Test
    void sameEmojiRemovesExistingReaction() {
        List<Reaction> result = Reactions.toggle(initial, "👍", "u1", "One");

        assertEquals(List.of(initial.get(1)), result);
    }

    @Test
    void differentEmojiReplacesUsersReaction() {
        List<Reaction> result = Reactions.toggle(initial, "🔥", "u1", "One");

        assertEquals(2, result.size());
        assertEquals(1, result.stream().filter(reaction -> reaction.getUserId().equals("u1")).count());
        assertEquals("🔥", result.get(1).getEmoji());
    }

    @Test
    void missingDisplayNameDefaultsToGuest() {
        List<Reaction> result = Reactions.toggle(null, "👍", "u9", null);

        assertEquals(Reactions.DEFAULT_DISPLAY_NAME, result.get(0).getDisplayName());
    }

    @Test
    void inputListIsNotModified() {
        List<Reaction> mutable = new ArrayList<>(initial);

        Reactions.toggle(mutable, "👍", "u1", "One");

        assertTrue(mutable.containsAll(initial));
        assertEquals(2, mutable.size());
    }
}
