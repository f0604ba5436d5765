package com.phillippitts.realtimesync.service.dispatch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically cues every subscription to re-fetch while the live channel is unavailable.
 *
 * <p>Each tick hands one {@code POLL_UPDATE} cue per subscription to the {@link EventDispatcher}.
 * The first tick fires one interval after {@link #start()}. Start and stop are idempotent.
 *
 * <p>Thread-safe: start/stop synchronize on the driver; ticks run on the scheduler.
 */
public class PollingFallbackDriver {

    private static final Logger LOG = LogManager.getLogger(PollingFallbackDriver.class);

    private final ScheduledExecutorService scheduler;
    private final EventDispatcher dispatcher;
    private final long intervalMs;

    private ScheduledFuture<?> task;

    public PollingFallbackDriver(ScheduledExecutorService scheduler, EventDispatcher dispatcher, long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive, got: " + intervalMs);
        }
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.intervalMs = intervalMs;
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        task = scheduler.scheduleAtFixedRate(this::pollOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOG.info("Polling fallback started (interval={}ms)", intervalMs);
    }

    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        task = null;
        LOG.info("Polling fallback stopped");
    }

    public synchronized boolean isActive() {
        return task != null;
    }

    /**
     * Runs one polling tick. A failure is logged and never cancels the periodic task.
     */
    void pollOnce() {
        try {
            int cued = dispatcher.deliverPollCues();
            LOG.debug("Poll tick delivered {} cue(s)", cued);
        } catch (RuntimeException ex) {
            // An exception escaping a fixed-rate task would cancel all future ticks
            LOG.warn("Poll tick failed: {}", ex.toString(), ex);
        }
    }
}
