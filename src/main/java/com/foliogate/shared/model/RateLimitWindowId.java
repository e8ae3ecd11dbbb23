package com.foliogate.shared.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite primary key for RateLimitWindow entity.
 */
public class RateLimitWindowId implements Serializable {

    private String principalId;
    private String operationClass;

    public RateLimitWindowId() {
    }

    public RateLimitWindowId(String principalId, String operationClass) {
        this.principalId = principalId;
        this.operationClass = operationClass;
    }

    public String getPrincipalId() {
        return principalId;
    }

    public String getOperationClass() {
        return operationClass;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RateLimitWindowId that = (RateLimitWindowId) o;
        return Objects.equals(principalId, that.principalId) &&
               Objects.equals(operationClass, that.operationClass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(principalId, operationClass);
    }

    @Override
    public String toString() {
        return principalId + "/" + operationClass;
    }
}
