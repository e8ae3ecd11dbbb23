package com.foliogate.api.resource;

import com.foliogate.shared.model.ResourceType;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of the resources that share links point at.
 * One implementation is registered per {@link ResourceType}.
 */
public interface ResourceCollaborator {

    ResourceType resourceType();

    /**
     * @return the owning principal id, empty if the resource does not exist
     */
    Optional<String> getOwner(UUID resourceId);

    boolean exists(UUID resourceId);
}
