package com.example.roomchat.service;

import com.example.roomchat.config.ChatProperties;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RoomHousekeepingScheduler {

    private final ChatProperties chatProperties;
    private final RoomMutationCoordinator roomMutationCoordinator;

    @Scheduled(fixedDelayString = "#{T(java.time.Duration).parse('${chat.housekeeping.interval:PT1M}').toMillis()}")
    public void purgeExpiredRooms() {
        Instant cutoff = computeCutoff(Instant.now(), chatProperties.getRooms().getTtl());
        if (cutoff == null) {
            return;
        }
        try {
            int purged = roomMutationCoordinator.purgeExpired(cutoff);
            if (purged > 0) {
                log.debug("Housekeeping removed {} expired room(s)", purged);
            }
        } catch (RuntimeException ex) {
            log.warn("Room housekeeping cycle failed", ex);
        }
    }

    static Instant computeCutoff(Instant now, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return null;
        }
        return now.minus(ttl);
    }
}
