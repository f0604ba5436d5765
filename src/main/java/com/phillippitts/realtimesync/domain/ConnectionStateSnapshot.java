package com.phillippitts.realtimesync.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of the connection state handed to connection listeners.
 *
 * @param connected            true only while {@code status == CONNECTED}
 * @param status               lifecycle status
 * @param reconnectAttempts    consecutive failed attempts since the last successful connect
 * @param maxReconnectAttempts attempts allowed before falling back
 * @param lastConnectedAt      time of the last successful connect, or {@code null}
 * @param lastError            description of the most recent failure, or {@code null}
 * @param quality              coarse quality rating
 */
public record ConnectionStateSnapshot(
        boolean connected,
        ConnectionStatus status,
        int reconnectAttempts,
        int maxReconnectAttempts,
        Instant lastConnectedAt,
        String lastError,
        ConnectionQuality quality
) {

    public ConnectionStateSnapshot {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(quality, "quality must not be null");
        if (connected != (status == ConnectionStatus.CONNECTED)) {
            throw new IllegalArgumentException(
                    "connected=" + connected + " is inconsistent with status " + status);
        }
        if (reconnectAttempts < 0) {
            throw new IllegalArgumentException("reconnectAttempts must be >= 0, got: " + reconnectAttempts);
        }
    }

    /**
     * State of a manager that has never connected.
     *
     * @param maxReconnectAttempts configured attempt limit
     * @return idle snapshot
     */
    public static ConnectionStateSnapshot idle(int maxReconnectAttempts) {
        return new ConnectionStateSnapshot(false, ConnectionStatus.IDLE, 0, maxReconnectAttempts,
                null, null, ConnectionQuality.GOOD);
    }

    /**
     * Derives a snapshot with a new status; {@code connected} follows the status.
     */
    public ConnectionStateSnapshot with(ConnectionStatus newStatus,
                                        int attempts,
                                        String error,
                                        ConnectionQuality newQuality) {
        return new ConnectionStateSnapshot(newStatus == ConnectionStatus.CONNECTED, newStatus, attempts,
                maxReconnectAttempts, lastConnectedAt, error, newQuality);
    }

    /**
     * Derives the snapshot for a fresh successful connection.
     */
    public ConnectionStateSnapshot connectedAt(Instant at) {
        return new ConnectionStateSnapshot(true, ConnectionStatus.CONNECTED, 0, maxReconnectAttempts,
                at, null, ConnectionQuality.EXCELLENT);
    }
}
