package com.phillippitts.realtimesync.service.connection.event;

import com.phillippitts.realtimesync.domain.ConnectionStateSnapshot;

import java.time.Instant;

/**
 * Published on the application event bus after every connection state transition.
 */
public record ConnectionStateChangedEvent(
        ConnectionStateSnapshot previous,
        ConnectionStateSnapshot current,
        Instant at
) {
    public ConnectionStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
