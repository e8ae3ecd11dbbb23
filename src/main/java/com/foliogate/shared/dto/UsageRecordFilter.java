package com.foliogate.shared.dto;

import com.foliogate.shared.model.UsageOutcome;

import java.time.Instant;

/**
 * Filter criteria for listing usage records. Null fields are ignored.
 * The time range is half-open: [from, to).
 */
public class UsageRecordFilter {

    private String principalId;
    private String operationClass;
    private String feature;
    private UsageOutcome outcome;
    private Instant from;
    private Instant to;

    public UsageRecordFilter() {
    }

    public String getPrincipalId() {
        return principalId;
    }

    public void setPrincipalId(String principalId) {
        this.principalId = principalId;
    }

    public String getOperationClass() {
        return operationClass;
    }

    public void setOperationClass(String operationClass) {
        this.operationClass = operationClass;
    }

    public String getFeature() {
        return feature;
    }

    public void setFeature(String feature) {
        this.feature = feature;
    }

    public UsageOutcome getOutcome() {
        return outcome;
    }

    public void setOutcome(UsageOutcome outcome) {
        this.outcome = outcome;
    }

    public Instant getFrom() {
        return from;
    }

    public void setFrom(Instant from) {
        this.from = from;
    }

    public Instant getTo() {
        return to;
    }

    public void setTo(Instant to) {
        this.to = to;
    }
}
