package com.phillippitts.realtimesync.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics tracking for the realtime channel.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Connection attempts, successes and failures (tagged by failure reason)</li>
 *   <li>Change events dispatched to consumers</li>
 *   <li>Consumer callback failures (error or timeout)</li>
 *   <li>Poll cues delivered during the polling fallback</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RealtimeMetrics {

    private static final String METRIC_PREFIX = "realtime";

    private final MeterRegistry registry;

    public RealtimeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementAttempt() {
        Counter.builder(METRIC_PREFIX + ".connection.attempts")
                .description("Number of channel connection attempts")
                .register(registry)
                .increment();
    }

    public void incrementSuccess() {
        Counter.builder(METRIC_PREFIX + ".connection.successes")
                .description("Number of acknowledged channel subscriptions")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure kind (open, timeout, closed, channel_error, timed_out, heartbeat, stale)
     */
    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".connection.failures")
                .description("Number of failed attempts and lost connections")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param deliveries number of callbacks the event reached
     */
    public void recordDispatch(int deliveries) {
        Counter.builder(METRIC_PREFIX + ".events.dispatched")
                .description("Number of callback deliveries of change events")
                .register(registry)
                .increment(deliveries);
    }

    /**
     * @param reason error or timeout
     */
    public void incrementCallbackFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".callback.failures")
                .description("Number of consumer callbacks that threw or exceeded their budget")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param deliveries number of subscriptions that received the cue
     */
    public void recordPollCues(int deliveries) {
        Counter.builder(METRIC_PREFIX + ".poll.cues")
                .description("Number of POLL_UPDATE cues delivered")
                .register(registry)
                .increment(deliveries);
    }
}
