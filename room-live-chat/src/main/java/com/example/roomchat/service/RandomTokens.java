package com.example.roomchat.service;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Short random identifiers for join codes, invite links and guest ids.
 */
public final class RandomTokens {

    private static final String BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz";

    private RandomTokens() {
    }

    /** Six digit join code without a leading zero. */
    public static String roomCode() {
        return Integer.toString(100_000 + ThreadLocalRandom.current().nextInt(900_000));
    }

    public static String inviteLinkId() {
        return base36(8);
    }

    public static String guestId() {
        return "guest_" + base36(8);
    }

    static String base36(int length) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder token = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            token.append(BASE36.charAt(random.nextInt(BASE36.length())));
        }
        return token.toString();
    }
}
