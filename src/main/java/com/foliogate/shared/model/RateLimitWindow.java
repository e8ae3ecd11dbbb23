package com.foliogate.shared.model;

import jakarta.persistence.*;

import java.time.Duration;
import java.time.Instant;

/**
 * Entity representing the fixed counting window of one principal for one operation class.
 * One row per (principal, class) pair, created lazily and updated under a row lock.
 */
@Entity
@Table(name = "rate_limit_windows", indexes = {
    @Index(name = "idx_rate_limit_windows_updated_at", columnList = "updated_at")
})
@IdClass(RateLimitWindowId.class)
public class RateLimitWindow {

    @Id
    @Column(name = "principal_id", length = 128, nullable = false)
    private String principalId;

    @Id
    @Column(name = "operation_class", length = 64, nullable = false)
    private String operationClass;

    @Column(name = "window_start", nullable = false)
    private Instant windowStart;

    @Column(name = "count", nullable = false)
    private Integer count;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected RateLimitWindow() {
    }

    public RateLimitWindow(String principalId, String operationClass, Instant windowStart) {
        this.principalId = principalId;
        this.operationClass = operationClass;
        this.windowStart = windowStart;
        this.count = 1;
        this.updatedAt = windowStart;
    }

    public boolean hasElapsed(Duration windowLength, Instant now) {
        return !now.isBefore(windowStart.plus(windowLength));
    }

    /**
     * Start a new window at {@code now} with this attempt counted.
     */
    public void restart(Instant now) {
        this.windowStart = now;
        this.count = 1;
        this.updatedAt = now;
    }

    public void increment(Instant now) {
        this.count = count + 1;
        this.updatedAt = now;
    }

    public void decrement(Instant now) {
        if (count > 0) {
            this.count = count - 1;
            this.updatedAt = now;
        }
    }

    public String getPrincipalId() {
        return principalId;
    }

    public String getOperationClass() {
        return operationClass;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Integer getCount() {
        return count;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
