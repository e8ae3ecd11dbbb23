package com.foliogate.shared.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Entity representing one audited gateway invocation attempt.
 * Maps to the usage_records table. Append-only: there are no setters and
 * Hibernate never issues updates for it.
 */
@Entity
@Immutable
@Table(name = "usage_records", indexes = {
    @Index(name = "idx_usage_records_created_at", columnList = "created_at"),
    @Index(name = "idx_usage_records_principal_class", columnList = "principal_id, operation_class")
})
public class UsageRecord implements Persistable<UUID> {

    public static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "principal_id", nullable = false, updatable = false, length = 128)
    @NotNull
    private String principalId;

    @Column(name = "operation_class", nullable = false, updatable = false, length = 64)
    @NotNull
    private String operationClass;

    @Column(name = "feature", updatable = false, length = 50)
    private String feature;

    @Column(name = "created_at", nullable = false, updatable = false)
    @NotNull
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, updatable = false, length = 20)
    @NotNull
    private UsageOutcome outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind", updatable = false, length = 20)
    private FailureKind failureKind;

    @Column(name = "model_name", updatable = false, length = 64)
    private String model;

    @Column(name = "tokens_in", nullable = false, updatable = false)
    private int tokensIn;

    @Column(name = "tokens_out", nullable = false, updatable = false)
    private int tokensOut;

    @Column(name = "cost_estimate", nullable = false, updatable = false, precision = 10, scale = 6)
    private BigDecimal costEstimate;

    @Column(name = "error_message", updatable = false, columnDefinition = "TEXT")
    private String errorMessage;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", updatable = false, columnDefinition = "JSONB")
    private Map<String, Object> metadata;

    protected UsageRecord() {
    }

    public UsageRecord(UUID id, String principalId, String operationClass, String feature,
                       Instant timestamp, UsageOutcome outcome, FailureKind failureKind,
                       String model, int tokensIn, int tokensOut, BigDecimal costEstimate,
                       String errorMessage, Map<String, Object> metadata) {
        this.id = id;
        this.principalId = principalId;
        this.operationClass = operationClass;
        this.feature = feature;
        this.timestamp = timestamp;
        this.outcome = outcome;
        this.failureKind = failureKind;
        this.model = model;
        this.tokensIn = tokensIn;
        this.tokensOut = tokensOut;
        this.costEstimate = costEstimate != null ? costEstimate : BigDecimal.ZERO;
        this.errorMessage = truncate(errorMessage);
        this.metadata = metadata;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }

    @Override
    public UUID getId() {
        return id;
    }

    // Ids are assigned before saving and rows are never updated, so every save is an insert.
    @Override
    public boolean isNew() {
        return true;
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

    public UsageOutcome getOutcome() {
        return outcome;
    }

    public FailureKind getFailureKind() {
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
