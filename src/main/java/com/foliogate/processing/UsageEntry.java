package com.foliogate.processing;

import com.foliogate.shared.model.FailureKind;
import com.foliogate.shared.model.UsageOutcome;

import java.util.Map;

/**
 * Data for one ledger row before it gets an id and a timestamp.
 */
public record UsageEntry(String principalId, String operationClass, String feature,
                         UsageOutcome outcome, FailureKind failureKind, CostReport cost,
                         String errorMessage, Map<String, Object> metadata) {

    public UsageEntry {
        if (cost == null) {
            cost = CostReport.none();
        }
        metadata = metadata != null ? metadata : Map.of();
    }

    public static UsageEntry success(GatewayInvocation invocation, CostReport cost) {
        return new UsageEntry(invocation.principalId(), invocation.operationClass(), invocation.feature(),
                UsageOutcome.SUCCESS, null, cost, null, invocation.metadata());
    }

    public static UsageEntry failure(GatewayInvocation invocation, FailureKind kind, CostReport partialCost,
                                     String errorMessage) {
        return new UsageEntry(invocation.principalId(), invocation.operationClass(), invocation.feature(),
                UsageOutcome.FAILURE, kind, partialCost, errorMessage, invocation.metadata());
    }

    public static UsageEntry rateLimited(GatewayInvocation invocation, String deniedClass) {
        return new UsageEntry(invocation.principalId(), invocation.operationClass(), invocation.feature(),
                UsageOutcome.RATE_LIMITED, null, CostReport.none(),
                "Rate limit exceeded for " + deniedClass, invocation.metadata());
    }
}
