package com.foliogate.observability;

/**
 * Interface for Datadog metrics service to support both enabled and disabled modes.
 */
public interface DatadogMetricsServiceInterface {
    void recordGatewayInvocation(String operationClass, String feature, String outcome, long durationMs);
    void recordRateLimitDenied(String operationClass);
    void recordRateLimitStoreFailure(String operationClass);
    void recordLedgerFailure(String ledgerMode);
    void recordLlmLatency(long durationMs, String model, String feature);
    void recordLlmTokens(int inputTokens, int outputTokens, String model, String feature);
    void recordLlmCostEstimate(double costUsd, String model, String feature);
    void recordShareLinkIssued(String resourceType);
    void recordShareResolve(boolean found);
}
