package com.example.roomchat.config;

import com.example.roomchat.event.RoomAuditEvent;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.TopicConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

/**
 * Producer side of the audit trail. Audit events are best effort, so the producer waits for the
 * leader only and gives up quickly when the broker is unreachable.
 */
@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, RoomAuditEvent> auditEventProducerFactory(KafkaProperties properties) {
        Map<String, Object> config = properties.buildProducerProperties();
        config.putIfAbsent(ProducerConfig.ACKS_CONFIG, "1");
        config.putIfAbsent(ProducerConfig.MAX_BLOCK_MS_CONFIG, 2000);
        JsonSerializer<RoomAuditEvent> valueSerializer = new JsonSerializer<RoomAuditEvent>().noTypeInfo();
        return new DefaultKafkaProducerFactory<>(config, new StringSerializer(), valueSerializer);
    }

    @Bean
    public KafkaTemplate<String, RoomAuditEvent> auditEventKafkaTemplate(
            ProducerFactory<String, RoomAuditEvent> auditEventProducerFactory) {
        return new KafkaTemplate<>(auditEventProducerFactory);
    }

    @Bean
    public NewTopic auditTopic(ChatProperties chatProperties) {
        ChatProperties.Kafka kafka = chatProperties.getKafka();
        return TopicBuilder.name(kafka.getAuditTopic())
                .partitions(kafka.getAuditPartitions())
                .replicas(1)
                .config(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(kafka.getAuditRetention().toMillis()))
                .build();
    }
}
