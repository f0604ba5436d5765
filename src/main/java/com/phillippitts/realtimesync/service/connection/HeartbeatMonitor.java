package com.phillippitts.realtimesync.service.connection;

import com.phillippitts.realtimesync.service.channel.ChannelHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Sends a periodic heartbeat over a connected channel.
 *
 * <p>A heartbeat that cannot be sent is reported through {@link Listener#onHeartbeatFailed}. When a
 * stale threshold is configured, each tick also checks how long the channel has been silent
 * and reports {@link Listener#onStale} once the silence exceeds it.
 *
 * <p>At most one channel is monitored at a time; {@link #start} replaces any earlier run.
 * Ticks from a stopped run are ignored.
 */
public class HeartbeatMonitor {

    private static final Logger LOG = LogManager.getLogger(HeartbeatMonitor.class);

    /**
     * Receives heartbeat outcomes. Invoked on the scheduler thread.
     */
    public interface Listener {

        void onHeartbeatFailed(String reason, Throwable cause);

        void onStale(Duration silence);
    }

    private final ScheduledExecutorService scheduler;
    private final long intervalMs;
    private final long staleThresholdMs;

    private ScheduledFuture<?> task;
    private Object runToken;

    /**
     * @param scheduler        timer owner
     * @param intervalMs       heartbeat period
     * @param staleThresholdMs silence that counts as stale; 0 disables the check
     */
    public HeartbeatMonitor(ScheduledExecutorService scheduler, long intervalMs, long staleThresholdMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive, got: " + intervalMs);
        }
        if (staleThresholdMs < 0) {
            throw new IllegalArgumentException("staleThresholdMs must be >= 0, got: " + staleThresholdMs);
        }
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.intervalMs = intervalMs;
        this.staleThresholdMs = staleThresholdMs;
    }

    /**
     * Starts probing {@code channel}.
     *
     * @param channel     connected channel
     * @param lastEventAt time the last change event arrived (or the connect time)
     * @param listener    receives heartbeat failures and staleness
     */
    public synchronized void start(ChannelHandle channel, Supplier<Instant> lastEventAt, Listener listener) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(lastEventAt, "lastEventAt");
        Objects.requireNonNull(listener, "listener");
        cancelTask();
        Object token = new Object();
        runToken = token;
        task = scheduler.scheduleWithFixedDelay(() -> tick(token, channel, lastEventAt, listener),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOG.debug("Heartbeat started for channel {} (interval={}ms)", channel.name(), intervalMs);
    }

    public synchronized void stop() {
        if (task != null) {
            LOG.debug("Heartbeat stopped");
        }
        cancelTask();
        runToken = null;
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    private void cancelTask() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    private synchronized boolean isCurrent(Object token) {
        return runToken == token;
    }

    void tick(Object token, ChannelHandle channel, Supplier<Instant> lastEventAt, Listener listener) {
        if (!isCurrent(token)) {
            return;
        }
        try {
            channel.send(heartbeatMessage());
        } catch (RuntimeException ex) {
            LOG.warn("Heartbeat send failed on channel {}: {}", channel.name(), ex.toString());
            listener.onHeartbeatFailed("Heartbeat failed: " + ex.getMessage(), ex);
            return;
        }
        if (staleThresholdMs > 0) {
            Instant last = lastEventAt.get();
            if (last != null) {
                Duration silence = Duration.between(last, Instant.now());
                if (silence.toMillis() > staleThresholdMs) {
                    LOG.warn("Channel {} silent for {}ms (threshold {}ms)",
                            channel.name(), silence.toMillis(), staleThresholdMs);
                    listener.onStale(silence);
                }
            }
        }
    }

    static String heartbeatMessage() {
        return new JSONObject()
                .put("type", "heartbeat")
                .put("sentAt", Instant.now().toEpochMilli())
                .toString();
    }
}
