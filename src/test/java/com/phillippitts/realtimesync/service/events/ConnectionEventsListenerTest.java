package com.phillippitts.realtimesync.service.events;

import com.phillippitts.realtimesync.domain.ConnectionQuality;
import com.phillippitts.realtimesync.domain.ConnectionStateSnapshot;
import com.phillippitts.realtimesync.domain.ConnectionStatus;
import com.phillippitts.realtimesync.service.connection.event.ConnectionStateChangedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ConnectionEventsListenerTest {

    private static final ConnectionStateSnapshot IDLE = ConnectionStateSnapshot.idle(5);

    @Test
    void throttlesRepeatedKeys() {
        ConnectionEventsListener listener = new ConnectionEventsListener();

        assertThat(listener.shouldLog("reconnecting")).isTrue();
        assertThat(listener.shouldLog("reconnecting")).isFalse();
        assertThat(listener.shouldLog("polling")).isTrue();
    }

    @Test
    void handlersDoNotThrowForAnyStatus() {
        ConnectionEventsListener listener = new ConnectionEventsListener();
        ConnectionStateSnapshot reconnecting = IDLE.with(ConnectionStatus.RECONNECTING, 1,
                "Channel error occurred", ConnectionQuality.POOR);

        assertThatCode(() -> {
            for (ConnectionStatus status : ConnectionStatus.values()) {
                ConnectionStateSnapshot current = status == ConnectionStatus.CONNECTED
                        ? IDLE.connectedAt(Instant.now())
                        : IDLE.with(status, 1, "Channel error occurred", ConnectionQuality.POOR);
                listener.onStateChanged(new ConnectionStateChangedEvent(reconnecting, current, null));
                listener.onStateChanged(new ConnectionStateChangedEvent(reconnecting, current, null));
            }
        }).doesNotThrowAnyException();
    }
}
