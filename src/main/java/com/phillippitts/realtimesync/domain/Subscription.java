package com.phillippitts.realtimesync.domain;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A consumer's registered interest in change events.
 *
 * <p>Subscriptions outlive reconnects and the polling fallback; only an explicit
 * unsubscribe (or manager cleanup) removes them.
 *
 * @param id       caller-chosen unique id
 * @param filter   which events to receive
 * @param callback invoked for every matching event and for every poll cue
 */
public record Subscription(String id, EventFilter filter, Consumer<ChangeEvent> callback) {

    public Subscription {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Subscription id must not be blank");
        }
        Objects.requireNonNull(filter, "filter must not be null");
        Objects.requireNonNull(callback, "callback must not be null");
    }
}
