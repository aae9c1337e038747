package com.example.roomchat.domain;

import java.util.ArrayList;
import java.util.List;
import lombok.Value;
import org.springframework.util.StringUtils;

/**
 * The (userId, userEmail) pair bound to a connection. Either part may be absent; guests carry
 * their generated {@code guest_<token>} id as the user id.
 */
@Value
public class ConnectionIdentity {

    private static final ConnectionIdentity ANONYMOUS = new ConnectionIdentity(null, null);

    String userId;
    String userEmail;

    public static ConnectionIdentity anonymous() {
        return ANONYMOUS;
    }

    public static ConnectionIdentity of(String userId, String userEmail) {
        String id = StringUtils.hasText(userId) ? userId.trim() : null;
        String email = StringUtils.hasText(userEmail) ? userEmail.trim() : null;
        if (id == null && email == null) {
            return ANONYMOUS;
        }
        return new ConnectionIdentity(id, email);
    }

    public boolean isAnonymous() {
        return userId == null && userEmail == null;
    }

    /** Identifiers usable for owner and member matching, user id first. */
    public List<String> ids() {
        List<String> ids = new ArrayList<>(2);
        if (userId != null) {
            ids.add(userId);
        }
        if (userEmail != null) {
            ids.add(userEmail);
        }
        return ids;
    }

    /** Owner id recorded for rooms created by this identity; email is preferred. */
    public String preferredOwnerId() {
        return userEmail != null ? userEmail : userId;
    }
}
