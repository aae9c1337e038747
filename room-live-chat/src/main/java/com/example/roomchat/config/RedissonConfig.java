package com.example.roomchat.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson client for the distributed locks that serialize room, owner and message updates.
 * Connection settings come from {@code spring.data.redis}; the lock watchdog from
 * {@code chat.redis}.
 */
@Configuration
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(RedisProperties redisProperties, ChatProperties chatProperties) {
        Config config = new Config();
        config.setLockWatchdogTimeout(chatProperties.getRedis().getLockWatchdogTimeout().toMillis());

        SingleServerConfig server = config.useSingleServer()
                .setAddress(redisAddress(redisProperties))
                .setDatabase(redisProperties.getDatabase())
                .setClientName(chatProperties.getRedis().getKeyPrefix() + "-locks");
        if (StringUtils.hasText(redisProperties.getUsername())) {
            server.setUsername(redisProperties.getUsername());
        }
        if (StringUtils.hasText(redisProperties.getPassword())) {
            server.setPassword(redisProperties.getPassword());
        }
        if (redisProperties.getTimeout() != null) {
            server.setTimeout((int) redisProperties.getTimeout().toMillis());
        }
        return Redisson.create(config);
    }

    static String redisAddress(RedisProperties redisProperties) {
        boolean ssl = redisProperties.getSsl() != null && redisProperties.getSsl().isEnabled();
        return (ssl ? "rediss://" : "redis://") + redisProperties.getHost() + ":" + redisProperties.getPort();
    }
}
