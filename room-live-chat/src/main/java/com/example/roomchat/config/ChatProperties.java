package com.example.roomchat.config;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Rooms rooms = new Rooms();

    @NestedConfigurationProperty
    private final Messages messages = new Messages();

    @NestedConfigurationProperty
    private final Dispatch dispatch = new Dispatch();

    @NestedConfigurationProperty
    private final Housekeeping housekeeping = new Housekeeping();

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Rooms getRooms() {
        return rooms;
    }

    public Messages getMessages() {
        return messages;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Housekeeping getHousekeeping() {
        return housekeeping;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the chat module.
         */
        private String keyPrefix = "roomchat";

        /**
         * How long a lock outlives a crashed holder before Redisson releases it.
         */
        private Duration lockWatchdogTimeout = Duration.ofSeconds(30);

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getLockWatchdogTimeout() {
            return lockWatchdogTimeout;
        }

        public void setLockWatchdogTimeout(Duration lockWatchdogTimeout) {
            this.lockWatchdogTimeout = lockWatchdogTimeout;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Kafka topic receiving room, membership and authorisation audit events.
         */
        private String auditTopic = "roomchat.audit";

        @Min(1)
        private int auditPartitions = 6;

        /**
         * Retention applied when the audit topic is created by this service.
         */
        private Duration auditRetention = Duration.ofDays(7);

        public String getAuditTopic() {
            return auditTopic;
        }

        public void setAuditTopic(String auditTopic) {
            this.auditTopic = auditTopic;
        }

        public int getAuditPartitions() {
            return auditPartitions;
        }

        public void setAuditPartitions(int auditPartitions) {
            this.auditPartitions = auditPartitions;
        }

        public Duration getAuditRetention() {
            return auditRetention;
        }

        public void setAuditRetention(Duration auditRetention) {
            this.auditRetention = auditRetention;
        }
    }

    @Validated
    public static class Rooms {

        /**
         * Maximum number of rooms a single owner may have at the same time.
         */
        @Min(1)
        private int maxPerOwner = 5;

        /**
         * Age after which a room and its messages are removed by housekeeping.
         */
        private Duration ttl = Duration.ofHours(5);

        /**
         * Number of random join codes tried before room creation gives up.
         */
        @Min(1)
        private int codeAttempts = 10;

        public int getMaxPerOwner() {
            return maxPerOwner;
        }

        public void setMaxPerOwner(int maxPerOwner) {
            this.maxPerOwner = maxPerOwner;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public int getCodeAttempts() {
            return codeAttempts;
        }

        public void setCodeAttempts(int codeAttempts) {
            this.codeAttempts = codeAttempts;
        }
    }

    @Validated
    public static class Messages {

        /**
         * Default and maximum number of messages returned by the history endpoint.
         */
        @Min(1)
        private int historyLimit = 200;

        public int getHistoryLimit() {
            return historyLimit;
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
        }
    }

    @Validated
    public static class Dispatch {

        /**
         * Worker threads handling socket events off the Netty event loop.
         */
        @Min(1)
        private int corePoolSize = 8;

        @Min(1)
        private int maxPoolSize = 32;

        /**
         * Pending socket events buffered before new ones are rejected.
         */
        @Min(0)
        private int queueCapacity = 10_000;

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    @Validated
    public static class Housekeeping {

        /**
         * Interval between automatic housekeeping cycles.
         */
        private Duration interval = Duration.ofMinutes(1);

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }
}
