package com.foliogate.api;

import com.foliogate.shared.model.ResourceType;

import java.util.UUID;

/**
 * What an active public token points at.
 */
public record ResolvedShare(ResourceType resourceType, UUID resourceId) {
}
