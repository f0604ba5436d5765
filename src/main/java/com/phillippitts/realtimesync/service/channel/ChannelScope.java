package com.phillippitts.realtimesync.service.channel;

/**
 * Fixed table filter the shared channel is opened with.
 *
 * <p>Either part may be {@code "*"} to cover every schema or table. Subscriptions narrow this
 * scope further on the consumer side.
 *
 * @param schema schema name or {@code "*"}
 * @param table  table name or {@code "*"}
 */
public record ChannelScope(String schema, String table) {

    public static final String WILDCARD = "*";

    public ChannelScope {
        if (schema == null || schema.isBlank()) {
            throw new IllegalArgumentException("schema must not be blank");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table must not be blank");
        }
    }

    /**
     * Returns true if a change on {@code schema.table} falls inside this scope.
     */
    public boolean covers(String changeSchema, String changeTable) {
        return (WILDCARD.equals(schema) || schema.equals(changeSchema))
                && (WILDCARD.equals(table) || table.equals(changeTable));
    }

    @Override
    public String toString() {
        return schema + "." + table;
    }
}
