package com.foliogate.shared.exception;

/**
 * Quota for an operation class is used up for the current window.
 */
public class RateLimitExceededException extends RuntimeException {

    private final String operationClass;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String operationClass, long retryAfterSeconds) {
        super("Rate limit exceeded for " + operationClass + ". Retry after " +
                Math.max(1, retryAfterSeconds) + " seconds.");
        this.operationClass = operationClass;
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
    }

    public String getOperationClass() {
        return operationClass;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
