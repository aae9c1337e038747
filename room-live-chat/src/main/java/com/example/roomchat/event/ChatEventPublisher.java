package com.example.roomchat.event;

import com.example.roomchat.config.ChatProperties;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes audit events to Kafka. Publication is fire-and-forget: a broker outage is logged and
 * never fails the socket operation that produced the event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatEventPublisher {

    private final KafkaTemplate<String, RoomAuditEvent> auditEventKafkaTemplate;
    private final ChatProperties chatProperties;

    public void publish(ChatEventType type, String roomId, String actorId, Map<String, Object> details) {
        RoomAuditEvent event = RoomAuditEvent.of(type, roomId, actorId, details);
        String topic = chatProperties.getKafka().getAuditTopic();
        try {
            auditEventKafkaTemplate.send(topic, roomId, event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish {} audit event for room {}", type, roomId, ex);
                        }
                    });
        } catch (RuntimeException ex) {
            log.warn("Failed to publish {} audit event for room {}", type, roomId, ex);
        }
    }

    public void authorizationDenied(String roomId, String actorId, String action) {
        publish(ChatEventType.AUTHORIZATION_DENIED, roomId, actorId, Map.of("action", action));
    }
}
