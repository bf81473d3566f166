package com.platform.driftengine.domain;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Warehouse table coordinates. Database and schema are optional.
 */
public record TableRef(String database, String schema, String table) {

    public TableRef {
        Objects.requireNonNull(table, "table");
    }

    public static TableRef of(String table) {
        return new TableRef(null, null, table);
    }

    public String qualifiedName() {
        StringJoiner joiner = new StringJoiner(".");
        if (database != null && !database.isBlank()) joiner.add(database);
        if (schema != null && !schema.isBlank()) joiner.add(schema);
        joiner.add(table);
        return joiner.toString();
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
