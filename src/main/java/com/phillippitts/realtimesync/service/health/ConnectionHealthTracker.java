package com.phillippitts.realtimesync.service.health;

import java.time.Instant;

/**
 * Bookkeeping of connection attempts, successes and failures.
 *
 * <p>Pure bookkeeping: other components read {@link #status()} to make decisions, the tracker
 * itself never triggers a transition. Counters survive teardown and reconnects and are only
 * cleared by {@link #reset()}.
 *
 * <p>Thread-safe: all methods synchronize on the tracker.
 */
public class ConnectionHealthTracker {

    /** Consecutive failures at which the connection stops counting as healthy. */
    static final int UNHEALTHY_CONSECUTIVE_FAILURES = 3;

    /** Success rate the connection must exceed to count as healthy. */
    static final double MIN_SUCCESS_RATE = 0.5;

    private long attempts;
    private long successes;
    private long failures;
    private int consecutiveFailures;
    private Instant lastAttemptAt;
    private Instant lastSuccessAt;
    private Instant lastFailureAt;

    public synchronized void recordAttempt() {
        attempts++;
        lastAttemptAt = Instant.now();
    }

    public synchronized void recordSuccess() {
        successes++;
        consecutiveFailures = 0;
        lastSuccessAt = Instant.now();
    }

    public synchronized void recordFailure() {
        failures++;
        consecutiveFailures++;
        lastFailureAt = Instant.now();
    }

    public synchronized void reset() {
        attempts = 0;
        successes = 0;
        failures = 0;
        consecutiveFailures = 0;
        lastAttemptAt = null;
        lastSuccessAt = null;
        lastFailureAt = null;
    }

    /**
     * Returns a consistent snapshot of the counters.
     */
    public synchronized Metrics status() {
        return new Metrics(attempts, successes, failures, consecutiveFailures,
                lastAttemptAt, lastSuccessAt, lastFailureAt);
    }

    /**
     * Immutable counter snapshot with derived health signals.
     */
    public record Metrics(
            long attempts,
            long successes,
            long failures,
            int consecutiveFailures,
            Instant lastAttemptAt,
            Instant lastSuccessAt,
            Instant lastFailureAt
    ) {

        /** {@code successes / attempts}, or 0 before the first attempt. */
        public double successRate() {
            return attempts == 0 ? 0.0 : (double) successes / attempts;
        }

        public boolean isHealthy() {
            return consecutiveFailures < UNHEALTHY_CONSECUTIVE_FAILURES && successRate() > MIN_SUCCESS_RATE;
        }
    }
}
