package com.foliogate.api.resource;

import com.foliogate.shared.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Looks up the collaborator for a resource type. A type with no collaborator
 * behaves as if none of its resources exist.
 */
public class ResourceCollaboratorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ResourceCollaboratorRegistry.class);

    private final Map<ResourceType, ResourceCollaborator> collaborators = new EnumMap<>(ResourceType.class);

    public ResourceCollaboratorRegistry(List<ResourceCollaborator> registered) {
        for (ResourceCollaborator collaborator : registered) {
            ResourceCollaborator previous = collaborators.putIfAbsent(collaborator.resourceType(), collaborator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate resource collaborator for type "
                        + collaborator.resourceType() + ": " + previous.getClass().getSimpleName()
                        + " and " + collaborator.getClass().getSimpleName());
            }
        }
        logger.info("Resource collaborators registered for types: {}", collaborators.keySet());
    }

    public Optional<String> getOwner(ResourceType resourceType, UUID resourceId) {
        ResourceCollaborator collaborator = collaborators.get(resourceType);
        return collaborator != null ? collaborator.getOwner(resourceId) : Optional.empty();
    }

    public boolean exists(ResourceType resourceType, UUID resourceId) {
        ResourceCollaborator collaborator = collaborators.get(resourceType);
        return collaborator != null && collaborator.exists(resourceId);
    }
}
