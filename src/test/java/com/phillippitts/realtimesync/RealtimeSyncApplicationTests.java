package com.phillippitts.realtimesync;

import com.phillippitts.realtimesync.domain.ChangeEvent;
import com.phillippitts.realtimesync.domain.ConnectionStatus;
import com.phillippitts.realtimesync.domain.EventFilter;
import com.phillippitts.realtimesync.domain.EventType;
import com.phillippitts.realtimesync.service.Registration;
import com.phillippitts.realtimesync.service.RealtimeSubscriptionManager;
import com.phillippitts.realtimesync.service.channel.ChannelStatus;
import com.phillippitts.realtimesync.service.channel.loopback.LoopbackChannelProvider;
import com.phillippitts.realtimesync.service.health.RealtimeHealthIndicator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest(
    properties = {
        "realtime.provider=loopback",
        "realtime.callback-timeout-ms=1000",
        "realtime.backoff.base-delay-ms=10",
        "realtime.backoff.cap-delay-ms=50",
        "realtime.backoff.jitter-ms=0"
    }
)
class RealtimeSyncApplicationTests {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @Autowired
    private RealtimeSubscriptionManager manager;

    @Autowired
    private LoopbackChannelProvider loopback;

    @Autowired
    private RealtimeHealthIndicator healthIndicator;

    @AfterEach
    void tearDown() {
        manager.cleanup();
    }

    @Test
    void contextLoads() {
        assertThat(manager.getConnectionState().status()).isEqualTo(ConnectionStatus.IDLE);
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void deliversLoopbackChangesToSubscribers() {
        List<ChangeEvent> received = new CopyOnWriteArrayList<>();
        Registration registration = manager.subscribe("leads-view", EventFilter.of("*", "public", "leads"), received::add);
        await().atMost(WAIT).until(() -> manager.getConnectionState().status() == ConnectionStatus.CONNECTED);

        loopback.publish("{\"eventType\":\"UPDATE\",\"schema\":\"public\",\"table\":\"leads\","
                + "\"new\":{\"id\":3,\"stage\":\"won\"},\"old\":{\"id\":3,\"stage\":\"open\"}}");

        await().atMost(WAIT).until(() -> !received.isEmpty());
        assertThat(received.get(0).eventType()).isEqualTo(EventType.UPDATE);
        assertThat(received.get(0).newRow()).containsEntry("stage", "won");
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);

        registration.remove();
        assertThat(loopback.openChannels()).isZero();
    }

    @Test
    void recoversAfterChannelError() {
        manager.subscribe("leads-view", EventFilter.allEvents("public", "leads"), e -> { });
        await().atMost(WAIT).until(() -> manager.getConnectionState().status() == ConnectionStatus.CONNECTED);
        // Counters are shared with the other tests in this context
        long failuresBefore = manager.getHealthStatus().failures();
        long successesBefore = manager.getHealthStatus().successes();

        loopback.emitStatus(ChannelStatus.CHANNEL_ERROR);

        await().atMost(WAIT).until(() -> manager.getConnectionState().status() == ConnectionStatus.CONNECTED
                && manager.getHealthStatus().successes() == successesBefore + 1);
        assertThat(manager.getHealthStatus().failures()).isEqualTo(failuresBefore + 1);
        assertThat(manager.getConnectionState().lastError()).isNull();
    }
}
