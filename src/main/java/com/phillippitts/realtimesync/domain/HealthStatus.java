package com.phillippitts.realtimesync.domain;

import java.time.Instant;

/**
 * Point-in-time health report returned by the manager facade.
 *
 * @param attempts             connection attempts since the last reset
 * @param successes            successful connections
 * @param failures             failed attempts and disconnects
 * @param consecutiveFailures  failures since the last success
 * @param successRate          successes / attempts, or 0 when no attempts were made
 * @param healthy              {@code consecutiveFailures < 3 && successRate > 0.5}
 * @param activeSubscriptions  registered subscriptions
 * @param channelStatus        provider-reported channel state, {@code "none"} without a channel
 * @param connectionStatus     lifecycle status of the state machine
 * @param lastAttemptAt        time of the last attempt, or {@code null}
 * @param lastSuccessAt        time of the last success, or {@code null}
 * @param lastFailureAt        time of the last failure, or {@code null}
 */
public record HealthStatus(
        long attempts,
        long successes,
        long failures,
        int consecutiveFailures,
        double successRate,
        boolean healthy,
        int activeSubscriptions,
        String channelStatus,
        ConnectionStatus connectionStatus,
        Instant lastAttemptAt,
        Instant lastSuccessAt,
        Instant lastFailureAt
) {
}
