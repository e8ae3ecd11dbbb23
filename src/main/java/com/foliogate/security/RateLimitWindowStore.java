package com.foliogate.security;

import java.time.Duration;
import java.time.Instant;

/**
 * Keyed storage of fixed rate-limit windows. Every method is atomic per
 * (principal, operation class) key; different keys never contend.
 */
public interface RateLimitWindowStore {

    /**
     * Atomic check-and-increment. Starts a fresh window at {@code now} when none exists or the
     * current one has elapsed; otherwise counts the attempt if the ceiling has room.
     */
    WindowConsumption tryConsume(String principalId, String operationClass,
                                 int ceiling, Duration windowLength, Instant now);

    /**
     * Gives back one slot taken by {@link #tryConsume} if the same window is still current.
     */
    void release(String principalId, String operationClass, Instant windowStart, Instant now);

    /**
     * Current count in the live window, 0 if there is none or it has elapsed.
     */
    int currentCount(String principalId, String operationClass, Duration windowLength, Instant now);

    /**
     * Drops windows untouched since {@code cutoff}.
     * @return number of windows removed
     */
    int purgeIdleSince(Instant cutoff);

    /**
     * Result of one consumption attempt.
     * @param allowed whether the attempt was counted
     * @param windowStart start of the window the attempt was evaluated against
     * @param count count in that window after the attempt
     */
    record WindowConsumption(boolean allowed, Instant windowStart, int count) {
    }
}
