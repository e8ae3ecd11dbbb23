package com.foliogate.shared.dto;

import java.util.UUID;

/**
 * Public view of a resolved share token. Carries only the resource reference.
 */
public class ResolvedShareResponse {

    private String resourceType;
    private UUID resourceId;

    public ResolvedShareResponse() {
    }

    public ResolvedShareResponse(String resourceType, UUID resourceId) {
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public void setResourceType(String resourceType) {
        this.resourceType = resourceType;
    }

    public UUID getResourceId() {
        return resourceId;
    }

    public void setResourceId(UUID resourceId) {
        this.resourceId = resourceId;
    }
}
