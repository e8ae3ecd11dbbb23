package com.foliogate.security;

/**
 * Answer of the rate limiter for one (principal, operation class) attempt.
 * A denial carries the number of seconds until the current window ends (at least 1).
 */
public record RateLimitDecision(String operationClass, boolean allowed, long retryAfterSeconds) {

    public static RateLimitDecision allow(String operationClass) {
        return new RateLimitDecision(operationClass, true, 0L);
    }

    public static RateLimitDecision deny(String operationClass, long retryAfterSeconds) {
        return new RateLimitDecision(operationClass, false, Math.max(1L, retryAfterSeconds));
    }
}
