package com.phillippitts.realtimesync.domain;

import java.util.Locale;

/**
 * Kind of change carried by a {@link ChangeEvent}.
 *
 * <p>{@link #POLL_UPDATE} never comes from the database; it is synthesized while the live
 * channel is unavailable to tell consumers to re-fetch their own state.
 */
public enum EventType {
    INSERT,
    UPDATE,
    DELETE,
    POLL_UPDATE;

    /**
     * Parses the wire name used by the change stream (case-insensitive).
     *
     * @param value wire value such as {@code "INSERT"}
     * @return matching event type
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    public static EventType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Event type must not be blank");
        }
        return EventType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
