package com.foliogate.shared.dto;

import com.foliogate.shared.model.ShareLink;

import java.time.Instant;
import java.util.UUID;

/**
 * DTO for share link response (owner view).
 */
public class ShareLinkResponse {

    private String token;
    private String shareUrl;
    private String resourceType;
    private UUID resourceId;
    private Instant createdAt;
    private Instant expiresAt;

    public ShareLinkResponse() {
    }

    public ShareLinkResponse(String token, String shareUrl, String resourceType, UUID resourceId,
                             Instant createdAt, Instant expiresAt) {
        this.token = token;
        this.shareUrl = shareUrl;
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public static ShareLinkResponse from(ShareLink link, String baseUrl) {
        String shareUrl = baseUrl + "/api/public/" + link.getResourceType().getPublicSegment()
                + "/" + link.getToken();
        return new ShareLinkResponse(
                link.getToken(),
                shareUrl,
                link.getResourceType().getValue(),
                link.getResourceId(),
                link.getCreatedAt(),
                link.getExpiresAt());
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getShareUrl() {
        return shareUrl;
    }

    public void setShareUrl(String shareUrl) {
        this.shareUrl = shareUrl;
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

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }
}
