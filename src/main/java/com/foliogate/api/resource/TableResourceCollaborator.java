package com.foliogate.api.resource;

import com.foliogate.shared.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Resource collaborator backed by a plain table holding id and owner columns,
 * with an optional soft-delete column.
 */
public class TableResourceCollaborator implements ResourceCollaborator {

    private static final Logger logger = LoggerFactory.getLogger(TableResourceCollaborator.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final ResourceType resourceType;
    private final JdbcTemplate jdbcTemplate;
    private final String ownerQuery;

    public TableResourceCollaborator(ResourceType resourceType, ResourceTableProperties.Table table,
                                     JdbcTemplate jdbcTemplate) {
        this.resourceType = resourceType;
        this.jdbcTemplate = jdbcTemplate;

        String sql = "SELECT " + identifier(table.getOwnerColumn())
                + " FROM " + identifier(table.getTable())
                + " WHERE " + identifier(table.getIdColumn()) + " = ?";
        if (table.getDeletedColumn() != null && !table.getDeletedColumn().isBlank()) {
            sql += " AND " + identifier(table.getDeletedColumn()) + " IS NULL";
        }
        this.ownerQuery = sql;
        logger.info("Resource collaborator for {}: {}", resourceType, ownerQuery);
    }

    private static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier in resource table config: " + name);
        }
        return name;
    }

    @Override
    public ResourceType resourceType() {
        return resourceType;
    }

    @Override
    public Optional<String> getOwner(UUID resourceId) {
        List<Object> owners = jdbcTemplate.query(ownerQuery, (rs, rowNum) -> rs.getObject(1), resourceId);
        return owners.stream().findFirst().map(String::valueOf);
    }

    @Override
    public boolean exists(UUID resourceId) {
        return getOwner(resourceId).isPresent();
    }
}
