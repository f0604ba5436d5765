package com.phillippitts.realtimesync.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RealtimeMetricsTest {

    private MeterRegistry registry;
    private RealtimeMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RealtimeMetrics(registry);
    }

    @Test
    void shouldCountConnectionAttemptsAndSuccesses() {
        metrics.incrementAttempt();
        metrics.incrementAttempt();
        metrics.incrementSuccess();

        assertThat(registry.find("realtime.connection.attempts").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("realtime.connection.successes").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagFailuresByReason() {
        metrics.incrementFailure("channel_error");
        metrics.incrementFailure("channel_error");
        metrics.incrementFailure("timeout");

        Counter channelErrors = registry.find("realtime.connection.failures").tag("reason", "channel_error").counter();
        Counter timeouts = registry.find("realtime.connection.failures").tag("reason", "timeout").counter();

        assertThat(channelErrors).isNotNull();
        assertThat(channelErrors.count()).isEqualTo(2.0);
        assertThat(timeouts.count()).isEqualTo(1.0);
    }

    @Test
    void shouldAccumulateDispatchAndPollCueCounts() {
        metrics.recordDispatch(3);
        metrics.recordDispatch(1);
        metrics.recordPollCues(2);

        assertThat(registry.find("realtime.events.dispatched").counter().count()).isEqualTo(4.0);
        assertThat(registry.find("realtime.poll.cues").counter().count()).isEqualTo(2.0);
    }

    @Test
    void shouldTagCallbackFailures() {
        metrics.incrementCallbackFailure("error");
        metrics.incrementCallbackFailure("timeout");

        assertThat(registry.find("realtime.callback.failures").tag("reason", "error").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("realtime.callback.failures").tag("reason", "timeout").counter().count())
                .isEqualTo(1.0);
    }
}
