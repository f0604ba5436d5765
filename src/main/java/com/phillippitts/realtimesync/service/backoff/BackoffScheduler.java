package com.phillippitts.realtimesync.service.backoff;

import com.phillippitts.realtimesync.config.properties.RealtimeProperties;

import java.util.Objects;
import java.util.Random;

/**
 * Computes reconnect delays with capped exponential growth and additive jitter.
 *
 * <pre>
 * delay(attempt) = min(baseDelay * 2^attempt, capDelay) + uniform[0, jitter)
 * </pre>
 *
 * <p>With defaults (1s base, 30s cap, 1s jitter) attempts 0..5 wait roughly
 * 1s, 2s, 4s, 8s, 16s, 30s; every later attempt waits 30s plus jitter.
 *
 * <p>Thread-safe: the only state is the random source, and {@link Random} is thread-safe.
 *
 * @since 1.0
 */
public final class BackoffScheduler {

    private final long baseDelayMs;
    private final long capDelayMs;
    private final long jitterMs;
    private final Random random;

    public BackoffScheduler(long baseDelayMs, long capDelayMs, long jitterMs, Random random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive, got: " + baseDelayMs);
        }
        if (capDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("capDelayMs (" + capDelayMs
                    + ") must be >= baseDelayMs (" + baseDelayMs + ")");
        }
        if (jitterMs < 0) {
            throw new IllegalArgumentException("jitterMs must be >= 0, got: " + jitterMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.capDelayMs = capDelayMs;
        this.jitterMs = jitterMs;
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Creates a scheduler from {@code realtime.backoff.*} properties.
     */
    public static BackoffScheduler from(RealtimeProperties.Backoff props) {
        return new BackoffScheduler(props.getBaseDelayMs(), props.getCapDelayMs(), props.getJitterMs(), new Random());
    }

    /**
     * Returns the delay before retry number {@code attempt} (0-based).
     *
     * @param attempt failed attempts already made minus one; negative values are treated as 0
     * @return delay in milliseconds, always {@code <= capDelay + jitter}
     */
    public long delayMs(int attempt) {
        return exponentialMs(attempt) + (jitterMs > 0 ? random.nextLong(jitterMs) : 0);
    }

    /**
     * Deterministic part of {@link #delayMs(int)}.
     */
    public long exponentialMs(int attempt) {
        int n = Math.max(0, attempt);
        // 2^62 already overflows any sane base; stop shifting well before that
        if (n >= 62 || baseDelayMs > (capDelayMs >> Math.min(n, 62))) {
            return capDelayMs;
        }
        return Math.min(baseDelayMs << n, capDelayMs);
    }

    public long maxDelayMs() {
        return capDelayMs + jitterMs;
    }
}
