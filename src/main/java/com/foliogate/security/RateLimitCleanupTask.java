package com.foliogate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Scheduled task to drop rate limit windows nobody has touched for a while.
 * Keeps the window table bounded; correctness never depends on it, since an
 * idle window has long elapsed and would be restarted on the next attempt anyway.
 * The retention must stay longer than the longest configured window.
 */
@Component
public class RateLimitCleanupTask {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitCleanupTask.class);

    private final RateLimitWindowStore windowStore;
    private final Clock clock;
    private final Duration idleRetention;

    public RateLimitCleanupTask(
            RateLimitWindowStore windowStore,
            Clock clock,
            @Value("${app.rate-limit.idle-retention:24h}") Duration idleRetention) {
        this.windowStore = windowStore;
        this.clock = clock;
        this.idleRetention = idleRetention;
    }

    /**
     * Runs every hour to delete windows idle longer than the retention.
     */
    @Scheduled(fixedDelayString = "${app.rate-limit.cleanup-interval-ms:3600000}")
    public void cleanupIdleWindows() {
        try {
            Instant cutoff = clock.instant().minus(idleRetention);
            int removed = windowStore.purgeIdleSince(cutoff);
            logger.debug("Cleaned up {} idle rate limit windows (idle since before {})", removed, cutoff);
        } catch (Exception e) {
            logger.error("Failed to cleanup idle rate limit windows", e);
        }
    }
}
