package com.foliogate.shared.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity representing a public share link for an owned resource.
 * Maps to the share_links table.
 *
 * Rows are never deleted. A link stops being usable when it is revoked or when
 * its expiry passes; while it is the resource's current link it holds the
 * resource's active slot, which is unique across the table.
 */
@Entity
@Table(name = "share_links", indexes = {
    @Index(name = "idx_share_links_token", columnList = "share_token"),
    @Index(name = "idx_share_links_resource", columnList = "resource_type, resource_id")
})
public class ShareLink {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "share_token", nullable = false, unique = true, updatable = false, length = 64)
    @NotNull
    private String token;

    @Enumerated(EnumType.STRING)
    @Column(name = "resource_type", nullable = false, updatable = false, length = 32)
    @NotNull
    private ResourceType resourceType;

    @Column(name = "resource_id", nullable = false, updatable = false)
    @NotNull
    private UUID resourceId;

    @Column(name = "owner_id", nullable = false, updatable = false, length = 128)
    @NotNull
    private String ownerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "active_slot", unique = true, length = 80)
    private String activeSlot;

    protected ShareLink() {
    }

    public ShareLink(String token, ResourceType resourceType, UUID resourceId, String ownerId,
                     Instant createdAt, Instant expiresAt) {
        this.token = token;
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.ownerId = ownerId;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.activeSlot = slotKey(resourceType, resourceId);
    }

    /**
     * Slot key shared by every link of one resource; at most one row holds it.
     */
    public static String slotKey(ResourceType resourceType, UUID resourceId) {
        return resourceType.name() + ":" + resourceId;
    }

    /**
     * A link is active when it is not revoked and its expiry (if any) is still ahead of {@code now}.
     */
    public boolean isActiveAt(Instant now) {
        return revokedAt == null && !isExpiredAt(now);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    /**
     * Revoke the link. Irreversible; a second call keeps the first timestamp.
     */
    public void revoke(Instant now) {
        if (revokedAt == null) {
            revokedAt = now;
        }
        activeSlot = null;
    }

    /**
     * Give up the resource's slot after expiry so a fresh link can take it.
     * Expiry itself is never written; it stays derived from expiresAt.
     */
    public void releaseSlot() {
        activeSlot = null;
    }

    public Long getId() {
        return id;
    }

    public String getToken() {
        return token;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }

    public UUID getResourceId() {
        return resourceId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Instant getRevokedAt() {
        return revokedAt;
    }

    public String getActiveSlot() {
        return activeSlot;
    }
}
