package com.foliogate.processing;

import com.foliogate.config.GovernanceProperties;
import com.foliogate.config.GovernanceProperties.LedgerMode;
import com.foliogate.config.GovernanceProperties.OperationClassPolicy;
import com.foliogate.observability.DatadogMetricsServiceInterface;
import com.foliogate.observability.TracingServiceInterface;
import com.foliogate.security.RateLimitDecision;
import com.foliogate.security.RateLimitService;
import com.foliogate.shared.exception.LedgerUnavailableException;
import com.foliogate.shared.exception.OperationFailedException;
import com.foliogate.shared.exception.RateLimitExceededException;
import com.foliogate.shared.model.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point for expensive operations. Every invocation is rate checked,
 * executed (or rejected) and then written to the usage ledger exactly once.
 *
 * The operation runs on its own executor so that a caller that times out or is
 * interrupted still reaches the ledger write.
 */
@Service
public class OperationGateway {

    private static final Logger logger = LoggerFactory.getLogger(OperationGateway.class);

    private final RateLimitService rateLimitService;
    private final UsageLedgerService usageLedgerService;
    private final GovernanceProperties governanceProperties;
    private final AsyncTaskExecutor operationExecutor;
    private final DatadogMetricsServiceInterface metricsService;
    private final TracingServiceInterface tracingService;
    private final Duration operationTimeout;

    public OperationGateway(
            RateLimitService rateLimitService,
            UsageLedgerService usageLedgerService,
            GovernanceProperties governanceProperties,
            @Qualifier("gatewayOperationExecutor") AsyncTaskExecutor operationExecutor,
            DatadogMetricsServiceInterface metricsService,
            TracingServiceInterface tracingService,
            @Value("${app.gateway.operation-timeout:60s}") Duration operationTimeout) {
        this.rateLimitService = rateLimitService;
        this.usageLedgerService = usageLedgerService;
        this.governanceProperties = governanceProperties;
        this.operationExecutor = operationExecutor;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.operationTimeout = operationTimeout;
    }

    /**
     * Runs the operation if the principal is within every applicable rate limit.
     *
     * @return the operation's result, released only once the ledger write has been handled
     * @throws RateLimitExceededException if any class denies; recorded as RATE_LIMITED
     * @throws OperationFailedException if the operation fails or times out; recorded as FAILURE
     * @throws LedgerUnavailableException if a blocking-ledger class succeeded but the record could not be written
     * @throws IllegalArgumentException if the operation class is not configured
     */
    public <T> OperationResult<T> invoke(GatewayInvocation invocation, GatedOperation<T> operation) {
        OperationClassPolicy policy = governanceProperties.policyFor(invocation.operationClass());
        List<String> classes = classesFor(invocation);

        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("operation_class", invocation.operationClass());
        attributes.put("feature", invocation.feature());
        return tracingService.trace("gateway.invoke", attributes,
                () -> doInvoke(invocation, classes, policy, operation));
    }

    private <T> OperationResult<T> doInvoke(GatewayInvocation invocation, List<String> classes,
                                            OperationClassPolicy policy, GatedOperation<T> operation) {
        long startTime = System.currentTimeMillis();

        RateLimitDecision decision = rateLimitService.checkAll(invocation.principalId(), classes);
        if (!decision.allowed()) {
            RateLimitExceededException rejection =
                    new RateLimitExceededException(decision.operationClass(), decision.retryAfterSeconds());
            recordNonSuccess(policy, UsageEntry.rateLimited(invocation, decision.operationClass()), rejection);
            finish(invocation, "RATE_LIMITED", startTime);
            throw rejection;
        }

        Callable<OperationResult<T>> task = operation::execute;
        Future<OperationResult<T>> future;
        try {
            future = operationExecutor.submit(task);
        } catch (RejectedExecutionException e) {
            OperationFailedException failure =
                    new OperationFailedException(FailureKind.INTERNAL, "Operation could not be scheduled", e);
            return fail(invocation, policy, failure, startTime);
        }

        OperationResult<T> result;
        try {
            result = future.get(operationTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            return fail(invocation, policy, toOperationFailure(e.getCause()), startTime);
        } catch (TimeoutException e) {
            future.cancel(true);
            OperationFailedException failure = new OperationFailedException(FailureKind.TIMEOUT,
                    "Operation timed out after " + operationTimeout.toMillis() + "ms", e);
            return fail(invocation, policy, failure, startTime);
        } catch (InterruptedException e) {
            future.cancel(true);
            // Clear the flag for the ledger write, restore it afterwards.
            Thread.interrupted();
            OperationFailedException failure =
                    new OperationFailedException(FailureKind.TIMEOUT, "Caller interrupted", e);
            try {
                return fail(invocation, policy, failure, startTime);
            } finally {
                Thread.currentThread().interrupt();
            }
        }

        if (result == null) {
            return fail(invocation, policy,
                    new OperationFailedException(FailureKind.INTERNAL, "Operation returned no result", null),
                    startTime);
        }

        writeSuccess(policy, UsageEntry.success(invocation, result.cost()));
        finish(invocation, "SUCCESS", startTime);
        return result;
    }

    private List<String> classesFor(GatewayInvocation invocation) {
        List<String> classes = new ArrayList<>();
        classes.add(invocation.operationClass());
        String generalClass = governanceProperties.getGeneralClass();
        if (generalClass != null && !generalClass.isBlank() && !classes.contains(generalClass)) {
            classes.add(generalClass);
        }
        return classes;
    }

    private static OperationFailedException toOperationFailure(Throwable cause) {
        if (cause instanceof OperationFailedException operationFailure) {
            return operationFailure;
        }
        return new OperationFailedException(FailureKind.INTERNAL,
                "Operation failed: " + (cause != null ? cause.getMessage() : "unknown error"), cause);
    }

    private <T> OperationResult<T> fail(GatewayInvocation invocation, OperationClassPolicy policy,
                                        OperationFailedException failure, long startTime) {
        logger.warn("Gated operation failed: principal={}, class={}, feature={}, kind={}, error={}",
                invocation.principalId(), invocation.operationClass(), invocation.feature(),
                failure.getKind(), failure.getMessage());
        UsageEntry entry = UsageEntry.failure(invocation, failure.getKind(), failure.getPartialCost(),
                failure.getMessage());
        recordNonSuccess(policy, entry, failure);
        finish(invocation, "FAILURE", startTime);
        throw failure;
    }

    private void writeSuccess(OperationClassPolicy policy, UsageEntry entry) {
        if (policy.getLedgerMode() == LedgerMode.ASYNC) {
            usageLedgerService.recordAsync(entry);
            return;
        }
        try {
            usageLedgerService.record(entry);
        } catch (LedgerUnavailableException e) {
            logger.error("Withholding result, usage record could not be written: principal={}, class={}, feature={}",
                    entry.principalId(), entry.operationClass(), entry.feature(), e);
            metricsService.recordLedgerFailure(LedgerMode.BLOCKING.name());
            throw e;
        }
    }

    // The caller sees the original error; a ledger failure rides along as suppressed.
    private void recordNonSuccess(OperationClassPolicy policy, UsageEntry entry, RuntimeException original) {
        if (policy.getLedgerMode() == LedgerMode.ASYNC) {
            usageLedgerService.recordAsync(entry);
            return;
        }
        try {
            usageLedgerService.record(entry);
        } catch (LedgerUnavailableException e) {
            logger.error("Usage record for {} outcome could not be written: principal={}, class={}, feature={}",
                    entry.outcome(), entry.principalId(), entry.operationClass(), entry.feature(), e);
            metricsService.recordLedgerFailure(LedgerMode.BLOCKING.name());
            original.addSuppressed(e);
        }
    }

    private void finish(GatewayInvocation invocation, String outcome, long startTime) {
        long durationMs = System.currentTimeMillis() - startTime;
        metricsService.recordGatewayInvocation(invocation.operationClass(), invocation.feature(), outcome, durationMs);
        logger.info("Gateway invocation finished: principal={}, class={}, feature={}, outcome={}, durationMs={}",
                invocation.principalId(), invocation.operationClass(), invocation.feature(), outcome, durationMs);
    }
}
