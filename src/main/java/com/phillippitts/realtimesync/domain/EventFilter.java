package com.phillippitts.realtimesync.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Consumer-side filter deciding which change events a subscription receives.
 *
 * <p>The event kind may be the wildcard {@link Event#ALL} ({@code "*"}); schema and table must
 * match exactly.
 *
 * @param event  event kind to accept
 * @param schema schema to accept
 * @param table  table to accept
 */
public record EventFilter(Event event, String schema, String table) {

    /** Event kinds a filter can select. */
    public enum Event {
        INSERT, UPDATE, DELETE, ALL;

        /**
         * Parses {@code "insert"}, {@code "update"}, {@code "delete"} or {@code "*"}.
         *
         * @param value wire value (case-insensitive)
         * @return matching filter event
         * @throws IllegalArgumentException if the value is unknown
         */
        public static Event fromWire(String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Filter event must not be blank");
            }
            String v = value.trim();
            if ("*".equals(v)) {
                return ALL;
            }
            return Event.valueOf(v.toUpperCase(Locale.ROOT));
        }

        public String wireName() {
            return this == ALL ? "*" : name().toLowerCase(Locale.ROOT);
        }
    }

    public EventFilter {
        Objects.requireNonNull(event, "event must not be null");
        if (schema == null || schema.isBlank()) {
            throw new IllegalArgumentException("schema must not be blank");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table must not be blank");
        }
    }

    /**
     * Creates a filter from wire values, e.g. {@code of("*", "public", "leads")}.
     */
    public static EventFilter of(String event, String schema, String table) {
        return new EventFilter(Event.fromWire(event), schema, table);
    }

    /**
     * Creates a filter accepting every event kind on one table.
     */
    public static EventFilter allEvents(String schema, String table) {
        return new EventFilter(Event.ALL, schema, table);
    }

    /**
     * Returns true if the given change event should be delivered under this filter.
     *
     * <p>Poll cues are not matched here; they are addressed to each subscription directly.
     *
     * @param change inbound change event
     * @return true when schema and table match exactly and the event kind is accepted
     */
    public boolean matches(ChangeEvent change) {
        if (change == null || change.isPollUpdate()) {
            return false;
        }
        if (!schema.equals(change.schema()) || !table.equals(change.table())) {
            return false;
        }
        return event == Event.ALL || event.name().equals(change.eventType().name());
    }

    @Override
    public String toString() {
        return event.wireName() + ":" + schema + "." + table;
    }
}
