package com.example.roomchat.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Audit record written to Kafka, keyed by room id. {@code actorId} is the owner id of the acting
 * identity and is absent for system actions such as expiry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoomAuditEvent implements Serializable {

    private String eventId;
    private ChatEventType type;
    private String roomId;
    private String actorId;
    private Instant occurredAt;
    private Map<String, Object> details;

    public static RoomAuditEvent of(ChatEventType type, String roomId, String actorId, Map<String, Object> details) {
        return RoomAuditEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .roomId(roomId)
                .actorId(actorId)
                .occurredAt(Instant.now())
                .details(details == null ? Map.of() : new HashMap<>(details))
                .build();
    }
}
