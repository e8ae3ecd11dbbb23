package com.foliogate.observability;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Stub implementation when Datadog is disabled.
 * Prevents NullPointerException when DatadogMetricsService is not available.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "false", matchIfMissing = true)
public class DatadogMetricsServiceStub implements DatadogMetricsServiceInterface {

    @Override
    public void recordGatewayInvocation(String operationClass, String feature, String outcome, long durationMs) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordRateLimitDenied(String operationClass) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordRateLimitStoreFailure(String operationClass) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordLedgerFailure(String ledgerMode) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordLlmLatency(long durationMs, String model, String feature) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordLlmTokens(int inputTokens, int outputTokens, String model, String feature) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordLlmCostEstimate(double costUsd, String model, String feature) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordShareLinkIssued(String resourceType) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordShareResolve(boolean found) {
        // No-op when Datadog is disabled
    }
}
