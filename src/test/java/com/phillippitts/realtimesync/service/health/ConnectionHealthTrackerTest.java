package com.phillippitts.realtimesync.service.health;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionHealthTrackerTest {

    private final ConnectionHealthTracker tracker = new ConnectionHealthTracker();

    @Test
    void startsEmptyAndUnhealthy() {
        ConnectionHealthTracker.Metrics m = tracker.status();

        assertThat(m.attempts()).isZero();
        assertThat(m.successRate()).isZero();
        assertThat(m.isHealthy()).isFalse();
        assertThat(m.lastAttemptAt()).isNull();
    }

    @Test
    void successResetsConsecutiveFailures() {
        tracker.recordAttempt();
        tracker.recordFailure();
        tracker.recordAttempt();
        tracker.recordFailure();
        assertThat(tracker.status().consecutiveFailures()).isEqualTo(2);

        tracker.recordAttempt();
        tracker.recordSuccess();

        ConnectionHealthTracker.Metrics m = tracker.status();
        assertThat(m.consecutiveFailures()).isZero();
        assertThat(m.failures()).isEqualTo(2);
        assertThat(m.successes()).isEqualTo(1);
        assertThat(m.lastSuccessAt()).isNotNull();
        assertThat(m.lastFailureAt()).isNotNull();
    }

    @Test
    void healthyRequiresSuccessRateAboveHalf() {
        tracker.recordAttempt();
        tracker.recordSuccess();
        tracker.recordAttempt();
        tracker.recordFailure();

        assertThat(tracker.status().successRate()).isEqualTo(0.5);
        assertThat(tracker.status().isHealthy()).isFalse();

        tracker.recordAttempt();
        tracker.recordSuccess();

        assertThat(tracker.status().successRate()).isGreaterThan(0.5);
        assertThat(tracker.status().isHealthy()).isTrue();
    }

    @Test
    void threeConsecutiveFailuresAreUnhealthyEvenWithGoodRate() {
        for (int i = 0; i < 10; i++) {
            tracker.recordAttempt();
            tracker.recordSuccess();
        }
        // Disconnects after a success count as failures without a new attempt
        tracker.recordFailure();
        tracker.recordFailure();
        assertThat(tracker.status().isHealthy()).isTrue();

        tracker.recordFailure();

        assertThat(tracker.status().successRate()).isEqualTo(1.0);
        assertThat(tracker.status().isHealthy()).isFalse();
    }

    @Test
    void resetClearsEverything() {
        tracker.recordAttempt();
        tracker.recordFailure();

        tracker.reset();

        ConnectionHealthTracker.Metrics m = tracker.status();
        assertThat(m.attempts()).isZero();
        assertThat(m.failures()).isZero();
        assertThat(m.consecutiveFailures()).isZero();
        assertThat(m.lastFailureAt()).isNull();
    }
}
