package com.lbg.markets.etl.watcher.domain;

/**
 * Logical target of a routed file: a table, plus optional schema and description.
 */
public record Destination(
        String table,
        String schema,
        String description
) {
    public Destination {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Destination table cannot be blank");
        }
        schema = schema != null && !schema.isBlank() ? schema : null;
        description = description != null && !description.isBlank() ? description : null;
    }

    public static Destination of(String table) {
        return new Destination(table, null, null);
    }

    /**
     * Table name qualified with the schema when one is configured.
     */
    public String qualifiedName() {
        return schema != null ? schema + "." + table : table;
    }
}
