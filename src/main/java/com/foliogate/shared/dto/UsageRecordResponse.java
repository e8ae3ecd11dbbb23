package com.foliogate.shared.dto;

import com.foliogate.shared.model.UsageRecord;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * DTO for usage records in the admin listing.
 */
public class UsageRecordResponse {

    private UUID id;
    private String principalId;
    private String operationClass;
    private String feature;
    private Instant timestamp;
    private String outcome;
    private String failureKind;
    private String model;
    private int tokensIn;
    private int tokensOut;
    private BigDecimal costEstimate;
    private String errorMessage;
    private Map<String, Object> metadata;

    public UsageRecordResponse() {
    }

    public static UsageRecordResponse from(UsageRecord record) {
        UsageRecordResponse response = new UsageRecordResponse();
        response.id = record.getId();
        response.principalId = record.getPrincipalId();
        response.operationClass = record.getOperationClass();
        response.feature = record.getFeature();
        response.timestamp = record.getTimestamp();
        response.outcome = record.getOutcome().name();
        response.failureKind = record.getFailureKind() != null ? record.getFailureKind().name() : null;
        response.model = record.getModel();
        response.tokensIn = record.getTokensIn();
        response.tokensOut = record.getTokensOut();
        response.costEstimate = record.getCostEstimate();
        response.errorMessage = record.getErrorMessage();
        response.metadata = record.getMetadata();
        return response;
    }

    public UUID getId() {
        return id;
    }

    public String getPrincipalId() {
        return principalId;
    }

    public String getOperationClass() {
        return operationClass;
    }

    public String getFeature() {
        return feature;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getOutcome() {
        return outcome;
    }

    public String getFailureKind() {
        return failureKind;
    }

    public String getModel() {
        return model;
    }

    public int getTokensIn() {
        return tokensIn;
    }

    public int getTokensOut() {
        return tokensOut;
    }

    public BigDecimal getCostEstimate() {
        return costEstimate;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
