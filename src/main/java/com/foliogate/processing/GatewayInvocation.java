package com.foliogate.processing;

import java.util.Map;

/**
 * One call through the gateway.
 *
 * @param principalId who the call is made for
 * @param operationClass the call's own class; the general class is checked in addition
 * @param feature feature name recorded in the ledger
 * @param metadata opaque values stored with the usage record
 */
public record GatewayInvocation(String principalId, String operationClass, String feature,
                                Map<String, Object> metadata) {

    public GatewayInvocation {
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("principalId is required");
        }
        if (operationClass == null || operationClass.isBlank()) {
            throw new IllegalArgumentException("operationClass is required");
        }
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
