package com.foliogate.api.resource;

import com.foliogate.shared.model.ResourceType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Where each resource type lives, bound from app.resources.tables.
 *
 * <pre>
 * app:
 *   resources:
 *     tables:
 *       resume: { table: resumes, id-column: id, owner-column: user_id, deleted-column: deleted_at }
 * </pre>
 */
@ConfigurationProperties(prefix = "app.resources")
public class ResourceTableProperties {

    private Map<ResourceType, Table> tables = new EnumMap<>(ResourceType.class);

    public Map<ResourceType, Table> getTables() {
        return tables;
    }

    public void setTables(Map<ResourceType, Table> tables) {
        this.tables = tables;
    }

    public static class Table {

        private String table;
        private String idColumn = "id";
        private String ownerColumn = "user_id";
        /** Nullable timestamp column; a non-null value marks the row soft-deleted. */
        private String deletedColumn;

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public String getIdColumn() {
            return idColumn;
        }

        public void setIdColumn(String idColumn) {
            this.idColumn = idColumn;
        }

        public String getOwnerColumn() {
            return ownerColumn;
        }

        public void setOwnerColumn(String ownerColumn) {
            this.ownerColumn = ownerColumn;
        }

        public String getDeletedColumn() {
            return deletedColumn;
        }

        public void setDeletedColumn(String deletedColumn) {
            this.deletedColumn = deletedColumn;
        }
    }
}
