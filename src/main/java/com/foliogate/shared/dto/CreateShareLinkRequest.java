package com.foliogate.shared.dto;

import jakarta.validation.constraints.Positive;

/**
 * Request DTO for creating a share link. An absent TTL means the configured default.
 */
public class CreateShareLinkRequest {

    @Positive(message = "ttlSeconds must be positive")
    private Long ttlSeconds;

    public CreateShareLinkRequest() {
    }

    public CreateShareLinkRequest(Long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }

    public Long getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(Long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }
}
