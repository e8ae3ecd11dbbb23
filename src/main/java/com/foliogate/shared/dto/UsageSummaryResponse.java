package com.foliogate.shared.dto;

import java.math.BigDecimal;

/**
 * Aggregate totals over the usage records matching a filter.
 */
public class UsageSummaryResponse {

    private long attempts;
    private long successes;
    private long failures;
    private long rateLimited;
    private long tokensIn;
    private long tokensOut;
    private BigDecimal totalCost;

    public UsageSummaryResponse() {
    }

    public UsageSummaryResponse(long attempts, long successes, long failures, long rateLimited,
                                long tokensIn, long tokensOut, BigDecimal totalCost) {
        this.attempts = attempts;
        this.successes = successes;
        this.failures = failures;
        this.rateLimited = rateLimited;
        this.tokensIn = tokensIn;
        this.tokensOut = tokensOut;
        this.totalCost = totalCost;
    }

    public long getAttempts() {
        return attempts;
    }

    public long getSuccesses() {
        return successes;
    }

    public long getFailures() {
        return failures;
    }

    public long getRateLimited() {
        return rateLimited;
    }

    public long getTokensIn() {
        return tokensIn;
    }

    public long getTokensOut() {
        return tokensOut;
    }

    public BigDecimal getTotalCost() {
        return totalCost;
    }
}
