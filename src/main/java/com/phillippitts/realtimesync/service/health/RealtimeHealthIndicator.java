package com.phillippitts.realtimesync.service.health;

import com.phillippitts.realtimesync.domain.ConnectionStatus;
import com.phillippitts.realtimesync.domain.HealthStatus;
import com.phillippitts.realtimesync.service.RealtimeSubscriptionManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the realtime channel.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: channel connected with healthy statistics, or idle with nothing to serve</li>
 *   <li>DEGRADED: connecting, reconnecting, polling fallback, or connected with poor statistics</li>
 *   <li>DOWN: reconnection abandoned without fallback</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RealtimeHealthIndicator implements HealthIndicator {

    private final RealtimeSubscriptionManager manager;

    public RealtimeHealthIndicator(RealtimeSubscriptionManager manager) {
        this.manager = manager;
    }

    @Override
    public Health health() {
        HealthStatus status = manager.getHealthStatus();
        ConnectionStatus connection = status.connectionStatus();

        Health.Builder builder = new Health.Builder();
        if (connection == ConnectionStatus.FAILED) {
            builder.down().withDetail("status", "Realtime channel unavailable");
        } else if (connection == ConnectionStatus.IDLE) {
            builder.up().withDetail("status", "No active subscriptions");
        } else if (connection == ConnectionStatus.CONNECTED && status.healthy()) {
            builder.up().withDetail("status", "Realtime channel connected");
        } else if (connection == ConnectionStatus.POLLING) {
            builder.status("DEGRADED").withDetail("status", "Polling fallback active");
        } else {
            builder.status("DEGRADED").withDetail("status", "Realtime channel unstable");
        }

        return builder
                .withDetail("connectionStatus", connection.wireName())
                .withDetail("channelStatus", status.channelStatus())
                .withDetail("activeSubscriptions", status.activeSubscriptions())
                .withDetail("attempts", status.attempts())
                .withDetail("successes", status.successes())
                .withDetail("failures", status.failures())
                .withDetail("consecutiveFailures", status.consecutiveFailures())
                .withDetail("successRate", status.successRate())
                .withDetail("healthy", status.healthy())
                .build();
    }
}
