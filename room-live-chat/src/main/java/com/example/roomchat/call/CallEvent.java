package com.example.roomchat.call;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * A call notification produced by {@link CallSessionManager}.
 *
 * <p>For {@link CallEventType#EXISTING_PEERS} the {@code connectionId} is the only recipient. For
 * the other types it names the acting connection, which is excluded from the room broadcast;
 * {@link CallEventType#CALL_ENDED} carries no connection and reaches the whole room.
 */
@Value
@Builder
public class CallEvent {
    CallEventType type;
    String roomKey;
    String connectionId;
    Map<String, Object> payload;
}
