/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.relational;

import java.util.Objects;

import io.changestage.annotation.Immutable;

/**
 * Unique identifier of a captured table, used as the key of the per-table buffers of the redo event cache.
 *
 * @author Randall Hauch
 */
@Immutable
public final class TableId implements Comparable<TableId> {

    /**
     * Parse the supplied dot-separated string into a {@link TableId}. One part is a table name, two parts are a
     * schema and a table, three parts are a catalog, a schema and a table.
     *
     * @param str the string representation of the table identifier; may not be null
     * @return the table ID, or null if it could not be parsed
     */
    public static TableId parse(String str) {
        Objects.requireNonNull(str, "The table identifier may not be null");
        String[] parts = str.split("\\.");
        switch (parts.length) {
            case 1:
                return new TableId(null, null, parts[0]);
            case 2:
                return new TableId(null, parts[0], parts[1]);
            case 3:
                return new TableId(parts[0], parts[1], parts[2]);
            default:
                return null;
        }
    }

    private final String catalogName;
    private final String schemaName;
    private final String tableName;
    private final String id;

    /**
     * Create a new table identifier.
     *
     * @param catalogName the name of the database catalog that contains the table; may be null
     * @param schemaName the name of the database schema that contains the table; may be null
     * @param tableName the name of the table; may not be null
     */
    public TableId(String catalogName, String schemaName, String tableName) {
        this.catalogName = catalogName;
        this.schemaName = schemaName;
        this.tableName = Objects.requireNonNull(tableName, "The table name may not be null");
        this.id = tableId(this.catalogName, this.schemaName, this.tableName);
    }

    public String catalog() {
        return catalogName;
    }

    public String schema() {
        return schemaName;
    }

    public String table() {
        return tableName;
    }

    public String identifier() {
        return id;
    }

    @Override
    public int compareTo(TableId that) {
        if (this == that) {
            return 0;
        }
        return this.id.compareTo(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof TableId) {
            return this.compareTo((TableId) obj) == 0;
        }
        return false;
    }

    @Override
    public String toString() {
        return identifier();
    }

    private static String tableId(String catalog, String schema, String table) {
        if (catalog == null || catalog.isEmpty()) {
            if (schema == null || schema.isEmpty()) {
                return table;
            }
            return schema + "." + table;
        }
        if (schema == null || schema.isEmpty()) {
            return catalog + "." + table;
        }
        return catalog + "." + schema + "." + table;
    }
}
