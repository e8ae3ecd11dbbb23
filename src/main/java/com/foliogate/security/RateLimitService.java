package com.foliogate.security;

import com.foliogate.config.GovernanceProperties;
import com.foliogate.config.GovernanceProperties.FailurePolicy;
import com.foliogate.config.GovernanceProperties.OperationClassPolicy;
import com.foliogate.observability.DatadogMetricsServiceInterface;
import com.foliogate.security.RateLimitWindowStore.WindowConsumption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for per-principal, per-operation-class rate limiting over fixed windows.
 * Window length and ceiling come from {@link GovernanceProperties}; the counting itself
 * is delegated to the configured {@link RateLimitWindowStore}.
 */
@Service
public class RateLimitService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitService.class);
    private static final int MAX_INSERT_RACE_RETRIES = 2;

    private final RateLimitWindowStore windowStore;
    private final GovernanceProperties governanceProperties;
    private final DatadogMetricsServiceInterface metricsService;
    private final Clock clock;
    private final Duration failureRetryAfter;

    public RateLimitService(
            RateLimitWindowStore windowStore,
            GovernanceProperties governanceProperties,
            DatadogMetricsServiceInterface metricsService,
            Clock clock,
            @Value("${app.rate-limit.failure-retry-after:60s}") Duration failureRetryAfter) {
        this.windowStore = windowStore;
        this.governanceProperties = governanceProperties;
        this.metricsService = metricsService;
        this.clock = clock;
        this.failureRetryAfter = failureRetryAfter;
    }

    /**
     * Counts one attempt for the principal against the class's current window.
     *
     * @param principalId principal the attempt runs on behalf of
     * @param operationClass configured operation class (e.g. "ai_generation")
     * @return allow, or deny with the seconds left in the window
     * @throws IllegalArgumentException if the class is not configured
     */
    public RateLimitDecision check(String principalId, String operationClass) {
        return consume(principalId, operationClass).decision();
    }

    /**
     * Checks every class as a logical AND. When a class denies, slots already taken
     * on the classes before it are given back: the invocation never runs, so it is
     * not charged.
     *
     * @return the first denial, or an allow decision for the last class checked
     */
    public RateLimitDecision checkAll(String principalId, List<String> operationClasses) {
        if (operationClasses.isEmpty()) {
            throw new IllegalArgumentException("At least one operation class is required");
        }
        List<Consumption> taken = new ArrayList<>();
        for (String operationClass : operationClasses) {
            Consumption consumption = consume(principalId, operationClass);
            if (!consumption.decision().allowed()) {
                taken.forEach(c -> releaseQuietly(principalId, c));
                return consumption.decision();
            }
            taken.add(consumption);
        }
        return taken.get(taken.size() - 1).decision();
    }

    /**
     * Gets the current count for a principal and class in the live window.
     * Used for monitoring.
     */
    public int peek(String principalId, String operationClass) {
        OperationClassPolicy policy = governanceProperties.policyFor(operationClass);
        return windowStore.currentCount(principalId, operationClass, policy.getWindow(), now());
    }

    private Consumption consume(String principalId, String operationClass) {
        OperationClassPolicy policy = governanceProperties.policyFor(operationClass);
        Instant now = now();

        WindowConsumption consumption;
        try {
            consumption = tryConsumeWithRetry(principalId, operationClass, policy, now);
        } catch (RuntimeException e) {
            return onStoreFailure(principalId, operationClass, policy, e);
        }

        if (consumption.allowed()) {
            logger.debug("Rate limit allowed: principal={}, class={}, count={}, ceiling={}",
                    principalId, operationClass, consumption.count(), policy.getCeiling());
            return new Consumption(RateLimitDecision.allow(operationClass), consumption.windowStart(), operationClass);
        }

        Instant windowEnd = consumption.windowStart().plus(policy.getWindow());
        long retryAfter = secondsUntil(now, windowEnd);
        logger.info("Rate limit exceeded: principal={}, class={}, count={}, ceiling={}, retryAfter={}s",
                principalId, operationClass, consumption.count(), policy.getCeiling(), retryAfter);
        metricsService.recordRateLimitDenied(operationClass);
        return new Consumption(RateLimitDecision.deny(operationClass, retryAfter), null, operationClass);
    }

    private WindowConsumption tryConsumeWithRetry(String principalId, String operationClass,
                                                  OperationClassPolicy policy, Instant now) {
        DataIntegrityViolationException lastRace = null;
        for (int attempt = 0; attempt <= MAX_INSERT_RACE_RETRIES; attempt++) {
            try {
                return windowStore.tryConsume(principalId, operationClass,
                        policy.getCeiling(), policy.getWindow(), now);
            } catch (DataIntegrityViolationException e) {
                // Lost the race to create the first window row; the row exists now.
                logger.debug("Window insert race: principal={}, class={}, attempt={}",
                        principalId, operationClass, attempt + 1);
                lastRace = e;
            }
        }
        throw lastRace;
    }

    private Consumption onStoreFailure(String principalId, String operationClass,
                                       OperationClassPolicy policy, RuntimeException e) {
        metricsService.recordRateLimitStoreFailure(operationClass);
        if (policy.getFailurePolicy() == FailurePolicy.FAIL_OPEN) {
            logger.warn("Rate limit store unavailable, failing open: principal={}, class={}, error={}",
                    principalId, operationClass, e.getMessage());
            return new Consumption(RateLimitDecision.allow(operationClass), null, operationClass);
        }
        logger.error("Rate limit store unavailable, failing closed: principal={}, class={}",
                principalId, operationClass, e);
        return new Consumption(
                RateLimitDecision.deny(operationClass, Math.max(1L, failureRetryAfter.toSeconds())),
                null, operationClass);
    }

    private void releaseQuietly(String principalId, Consumption consumption) {
        if (consumption.windowStart() == null) {
            return; // allowed by fail-open, nothing was counted
        }
        try {
            windowStore.release(principalId, consumption.operationClass(), consumption.windowStart(), now());
        } catch (RuntimeException e) {
            logger.warn("Failed to release rate limit slot: principal={}, class={}, error={}",
                    principalId, consumption.operationClass(), e.getMessage());
        }
    }

    private static long secondsUntil(Instant now, Instant windowEnd) {
        long millis = Duration.between(now, windowEnd).toMillis();
        return Math.max(1L, (millis + 999) / 1000);
    }

    // Stored timestamps have microsecond precision; compare like with like.
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private record Consumption(RateLimitDecision decision, Instant windowStart, String operationClass) {
    }
}
