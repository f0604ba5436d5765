package com.phillippitts.realtimesync.domain;

import java.util.Locale;

/**
 * Lifecycle status of the shared realtime channel.
 *
 * <pre>
 * IDLE → CONNECTING → CONNECTED | RECONNECTING | POLLING | FAILED
 * CONNECTED → RECONNECTING (error/close) | IDLE (teardown)
 * RECONNECTING → CONNECTING (after backoff)
 * POLLING | FAILED → CONNECTING (forced reconnect only); any → IDLE (teardown)
 * </pre>
 */
public enum ConnectionStatus {
    IDLE,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    POLLING,
    FAILED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** True for statuses in which automatic reconnection has stopped. */
    public boolean isGivenUp() {
        return this == POLLING || this == FAILED;
    }
}
