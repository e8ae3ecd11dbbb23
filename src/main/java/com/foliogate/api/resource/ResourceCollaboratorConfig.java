package com.foliogate.api.resource;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a {@link TableResourceCollaborator} for every configured resource table.
 * Collaborator beans defined elsewhere are registered alongside them.
 */
@Configuration
@EnableConfigurationProperties(ResourceTableProperties.class)
public class ResourceCollaboratorConfig {

    @Bean
    public ResourceCollaboratorRegistry resourceCollaboratorRegistry(
            ResourceTableProperties properties,
            JdbcTemplate jdbcTemplate,
            ObjectProvider<ResourceCollaborator> additionalCollaborators) {
        List<ResourceCollaborator> collaborators = properties.getTables().entrySet().stream()
                .map(entry -> (ResourceCollaborator) new TableResourceCollaborator(entry.getKey(), entry.getValue(), jdbcTemplate))
                .collect(Collectors.toList());
        additionalCollaborators.orderedStream().forEach(collaborators::add);
        return new ResourceCollaboratorRegistry(collaborators);
    }
}
