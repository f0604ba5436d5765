package com.phillippitts.realtimesync.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable row-change notification delivered to subscription callbacks.
 *
 * <p>Rows are column-name to value maps. Either row may be {@code null}: inserts carry no
 * old row, deletes carry no new row, and {@link EventType#POLL_UPDATE} cues carry neither.
 * Column values may themselves be {@code null}.
 *
 * @param eventType kind of change
 * @param schema    database schema of the changed table
 * @param table     changed table
 * @param newRow    row after the change, or {@code null}
 * @param oldRow    row before the change, or {@code null}
 */
public record ChangeEvent(
        EventType eventType,
        String schema,
        String table,
        Map<String, Object> newRow,
        Map<String, Object> oldRow
) {

    public ChangeEvent {
        Objects.requireNonNull(eventType, "eventType must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(table, "table must not be null");
        newRow = copyOrNull(newRow);
        oldRow = copyOrNull(oldRow);
    }

    /**
     * Creates the generic "check for updates" cue for a table.
     *
     * @param schema schema of the watched table
     * @param table  watched table
     * @return a {@link EventType#POLL_UPDATE} event without row data
     */
    public static ChangeEvent pollUpdate(String schema, String table) {
        return new ChangeEvent(EventType.POLL_UPDATE, schema, table, null, null);
    }

    public boolean isPollUpdate() {
        return eventType == EventType.POLL_UPDATE;
    }

    private static Map<String, Object> copyOrNull(Map<String, Object> row) {
        // Map.copyOf rejects null column values, which are legal here
        return row == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(row));
    }
}
