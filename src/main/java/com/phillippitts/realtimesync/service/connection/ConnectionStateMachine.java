package com.phillippitts.realtimesync.service.connection;

import com.phillippitts.realtimesync.config.properties.RealtimeProperties;
import com.phillippitts.realtimesync.domain.ChangeEvent;
import com.phillippitts.realtimesync.domain.ConnectionQuality;
import com.phillippitts.realtimesync.domain.ConnectionStateSnapshot;
import com.phillippitts.realtimesync.domain.ConnectionStatus;
import com.phillippitts.realtimesync.exception.ChangePayloadException;
import com.phillippitts.realtimesync.exception.ChannelClosedException;
import com.phillippitts.realtimesync.exception.ChannelOpenException;
import com.phillippitts.realtimesync.exception.RealtimeSyncException;
import com.phillippitts.realtimesync.exception.SubscribeTimeoutException;
import com.phillippitts.realtimesync.service.Registration;
import com.phillippitts.realtimesync.service.backoff.BackoffScheduler;
import com.phillippitts.realtimesync.service.channel.ChangePayloadParser;
import com.phillippitts.realtimesync.service.channel.ChannelHandle;
import com.phillippitts.realtimesync.service.channel.ChannelProvider;
import com.phillippitts.realtimesync.service.channel.ChannelScope;
import com.phillippitts.realtimesync.service.channel.ChannelStatus;
import com.phillippitts.realtimesync.service.connection.event.ConnectionStateChangedEvent;
import com.phillippitts.realtimesync.service.dispatch.EventDispatcher;
import com.phillippitts.realtimesync.service.dispatch.PollingFallbackDriver;
import com.phillippitts.realtimesync.service.health.ConnectionHealthTracker;
import com.phillippitts.realtimesync.service.metrics.RealtimeMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sole owner of the shared channel, its timers and the connection state.
 *
 * <p>State transitions:
 * <pre>
 * IDLE → CONNECTING            (first subscription)
 * CONNECTING → CONNECTED       (provider acknowledged)
 * CONNECTING → RECONNECTING    (open error, failure status or acknowledgement timeout)
 * CONNECTED → RECONNECTING     (channel closed/errored, heartbeat failure, stale channel)
 * RECONNECTING → CONNECTING    (backoff elapsed)
 * CONNECTING → POLLING|FAILED  (maxReconnectAttempts consecutive failures)
 * any → CONNECTING             (forceReconnect)
 * any → IDLE                   (teardown)
 * </pre>
 *
 * <p><b>Thread Safety:</b> one {@link ReentrantLock} guards every mutation of state, timers
 * and the channel handle. Each channel gets a fresh generation number; provider and timer
 * callbacks carrying an older generation are ignored, so a late acknowledgement or error from
 * a discarded channel can never affect the current one. Nothing blocks while the lock is
 * held: the acknowledgement wait is a scheduled timeout task.
 *
 * <p>Listeners and the application event bus never run under the lock. Each transition is
 * queued while the lock is held and delivered right after it is released, in transition order
 * and only when the snapshot actually changed. At most one thread delivers at a time; a
 * listener may call back into the machine or the facade.
 */
public class ConnectionStateMachine {

    private static final Logger LOG = LogManager.getLogger(ConnectionStateMachine.class);

    static final String STALE_ERROR = "Connection stale - no data received";

    private final ChannelProvider provider;
    private final String channelName;
    private final ChannelScope scope;
    private final int maxReconnectAttempts;
    private final boolean fallbackToPolling;
    private final long subscribeTimeoutMs;
    private final EventDispatcher dispatcher;
    private final ConnectionHealthTracker health;
    private final BackoffScheduler backoff;
    private final HeartbeatMonitor heartbeat;
    private final PollingFallbackDriver polling;
    private final ScheduledExecutorService scheduler;
    private final RealtimeMetrics metrics;
    private final ApplicationEventPublisher publisher;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();
    private final Queue<Runnable> notifications = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean delivering = new AtomicBoolean();

    private volatile ConnectionStateSnapshot state;
    private volatile long generation;
    private volatile ChannelHandle channel;
    private volatile Instant lastEventAt;
    private ScheduledFuture<?> retryTask;
    private ScheduledFuture<?> ackTimeoutTask;

    /**
     * @param publisher receives {@link ConnectionStateChangedEvent}s; may be {@code null}
     */
    public ConnectionStateMachine(ChannelProvider provider,
                                  RealtimeProperties props,
                                  EventDispatcher dispatcher,
                                  ConnectionHealthTracker health,
                                  BackoffScheduler backoff,
                                  HeartbeatMonitor heartbeat,
                                  PollingFallbackDriver polling,
                                  ScheduledExecutorService scheduler,
                                  RealtimeMetrics metrics,
                                  ApplicationEventPublisher publisher) {
        this.provider = Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(props, "props");
        this.channelName = props.getChannel().getName();
        this.scope = new ChannelScope(props.getChannel().getSchema(), props.getChannel().getTable());
        this.maxReconnectAttempts = props.getMaxReconnectAttempts();
        this.fallbackToPolling = props.isFallbackToPolling();
        this.subscribeTimeoutMs = props.getSubscribeTimeoutMs();
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.health = Objects.requireNonNull(health, "health");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat");
        this.polling = Objects.requireNonNull(polling, "polling");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = publisher;
        this.state = ConnectionStateSnapshot.idle(maxReconnectAttempts);
    }

    /**
     * Starts connecting in the background if the machine is idle; otherwise does nothing.
     * Returns immediately.
     */
    public void ensureConnected() {
        lock.lock();
        try {
            if (state.status() != ConnectionStatus.IDLE) {
                return;
            }
            long gen = ++generation;
            transition(state.with(ConnectionStatus.CONNECTING, 0, null, ConnectionQuality.GOOD));
            scheduler.execute(() -> runRequested(gen));
        } finally {
            unlockAndNotify();
        }
    }

    /**
     * Abandons the current channel and connects again right away, without backoff and with
     * the attempt counter reset. Works from every status, including POLLING and FAILED.
     */
    public void forceReconnect() {
        lock.lock();
        try {
            LOG.info("Forced reconnect requested (status={})", state.status().wireName());
            polling.stop();
            beginAttempt(0, null, ConnectionQuality.GOOD);
        } finally {
            unlockAndNotify();
        }
    }

    /**
     * Reacts to a lost live channel: CONNECTED → RECONNECTING with a scheduled retry.
     * Ignored in every other status.
     *
     * @param reason recorded as the snapshot's last error
     */
    public void handleDisconnect(String reason) {
        lock.lock();
        try {
            if (state.status() == ConnectionStatus.CONNECTED) {
                disconnected(reason, "closed");
            }
        } finally {
            unlockAndNotify();
        }
    }

    /**
     * Cancels every timer, closes the channel and returns to IDLE with attempts cleared.
     * Safe to call repeatedly.
     */
    public void teardown() {
        lock.lock();
        try {
            generation++;
            cancelRetry();
            cancelAckTimeout();
            heartbeat.stop();
            polling.stop();
            boolean hadChannel = closeChannel();
            if (state.status() != ConnectionStatus.IDLE || hadChannel) {
                LOG.info("Realtime channel torn down");
            }
            transition(state.with(ConnectionStatus.IDLE, 0, null, ConnectionQuality.GOOD));
        } finally {
            unlockAndNotify();
        }
    }

    /**
     * Registers a listener and hands it the current snapshot before any later transition.
     * The first call happens on the registering thread unless another thread is delivering
     * notifications at that moment, in which case that thread delivers it.
     *
     * @return registration removing the listener
     */
    public Registration addListener(ConnectionStateListener listener) {
        Objects.requireNonNull(listener, "listener");
        lock.lock();
        try {
            listeners.add(listener);
            ConnectionStateSnapshot current = state;
            notifications.add(() -> notifyListener(listener, current));
        } finally {
            unlockAndNotify();
        }
        return () -> listeners.remove(listener);
    }

    public void clearListeners() {
        listeners.clear();
    }

    public ConnectionStateSnapshot getState() {
        return state;
    }

    /**
     * Provider-reported state of the current channel, or {@code "none"} without one.
     */
    public String channelState() {
        ChannelHandle current = channel;
        return current == null ? "none" : current.state();
    }

    // --- attempt lifecycle (callers hold the lock) ---

    private void runRequested(long gen) {
        lock.lock();
        try {
            if (gen != generation || state.status() != ConnectionStatus.CONNECTING) {
                return;
            }
            beginAttempt(state.reconnectAttempts(), state.lastError(), state.quality());
        } finally {
            unlockAndNotify();
        }
    }

    private void beginAttempt(int attempts, String error, ConnectionQuality quality) {
        cancelRetry();
        cancelAckTimeout();
        heartbeat.stop();
        closeChannel();
        long gen = ++generation;
        transition(state.with(ConnectionStatus.CONNECTING, attempts, error, quality));

        health.recordAttempt();
        metrics.incrementAttempt();
        LOG.info("Connecting realtime channel {} (scope={}, attempt {}/{})",
                channelName, scope, attempts + 1, maxReconnectAttempts);

        CompletableFuture<Void> request;
        try {
            ChannelHandle handle = provider.open(channelName);
            channel = handle;
            lastEventAt = Instant.now();
            handle.onChange(scope, payload -> onPayload(gen, payload));
            ackTimeoutTask = scheduler.schedule(() -> onAckTimeout(gen), subscribeTimeoutMs, TimeUnit.MILLISECONDS);
            request = handle.subscribe(status -> onChannelStatus(gen, status));
        } catch (RuntimeException ex) {
            attemptFailed(gen, new ChannelOpenException(channelName, ex), "open");
            return;
        }
        request.whenComplete((ignored, failure) -> {
            if (failure != null) {
                attemptFailedLocking(gen, new ChannelOpenException(channelName, unwrap(failure)), "open");
            }
        });
    }

    private void onChannelStatus(long gen, ChannelStatus status) {
        lock.lock();
        try {
            if (gen != generation) {
                LOG.debug("Ignoring {} from a discarded channel", status);
                return;
            }
            ConnectionStatus current = state.status();
            if (status == ChannelStatus.SUBSCRIBED) {
                if (current == ConnectionStatus.CONNECTING) {
                    connected();
                }
                return;
            }
            String reason = status.name().toLowerCase(Locale.ROOT);
            if (current == ConnectionStatus.CONNECTING) {
                attemptFailed(gen, new ChannelClosedException(status), reason);
            } else if (current == ConnectionStatus.CONNECTED) {
                disconnected(status.describe(), reason);
            }
        } finally {
            unlockAndNotify();
        }
    }

    private void connected() {
        cancelAckTimeout();
        health.recordSuccess();
        metrics.incrementSuccess();
        polling.stop();
        Instant now = Instant.now();
        lastEventAt = now;
        long gen = generation;
        transition(state.connectedAt(now));
        heartbeat.start(channel, () -> lastEventAt, new HeartbeatHandler(gen));
        LOG.info("Realtime channel {} connected", channelName);
    }

    private void onAckTimeout(long gen) {
        attemptFailedLocking(gen, new SubscribeTimeoutException(subscribeTimeoutMs), "timeout");
    }

    private void attemptFailedLocking(long gen, RealtimeSyncException cause, String reason) {
        lock.lock();
        try {
            attemptFailed(gen, cause, reason);
        } finally {
            unlockAndNotify();
        }
    }

    private void attemptFailed(long gen, RealtimeSyncException cause, String reason) {
        if (gen != generation || state.status() != ConnectionStatus.CONNECTING) {
            return;
        }
        cancelAckTimeout();
        closeChannel();
        health.recordFailure();
        metrics.incrementFailure(reason);
        LOG.warn("Connection attempt {}/{} failed: {}",
                state.reconnectAttempts() + 1, maxReconnectAttempts, cause.getMessage());
        retryOrFallBack(cause.getMessage());
    }

    private void disconnected(String reason, String metricReason) {
        heartbeat.stop();
        closeChannel();
        health.recordFailure();
        metrics.incrementFailure(metricReason);
        LOG.warn("Realtime channel {} lost: {}", channelName, reason);
        retryOrFallBack(reason);
    }

    private void retryOrFallBack(String error) {
        int attempts = state.reconnectAttempts() + 1;
        if (attempts >= maxReconnectAttempts) {
            if (fallbackToPolling) {
                polling.start();
                transition(state.with(ConnectionStatus.POLLING, attempts, error, ConnectionQuality.CRITICAL));
                LOG.error("Realtime channel unavailable after {} attempts; falling back to polling. Last error: {}",
                        attempts, error);
            } else {
                transition(state.with(ConnectionStatus.FAILED, attempts, error, ConnectionQuality.CRITICAL));
                LOG.error("Realtime channel unavailable after {} attempts; giving up. Last error: {}",
                        attempts, error);
            }
            return;
        }
        long delayMs = backoff.delayMs(attempts - 1);
        long gen = generation;
        transition(state.with(ConnectionStatus.RECONNECTING, attempts, error, ConnectionQuality.POOR));
        retryTask = scheduler.schedule(() -> retry(gen), delayMs, TimeUnit.MILLISECONDS);
        LOG.info("Reconnecting in {}ms (attempt {}/{})", delayMs, attempts + 1, maxReconnectAttempts);
    }

    private void retry(long gen) {
        lock.lock();
        try {
            if (gen != generation || state.status() != ConnectionStatus.RECONNECTING) {
                return;
            }
            retryTask = null;
            beginAttempt(state.reconnectAttempts(), state.lastError(), state.quality());
        } finally {
            unlockAndNotify();
        }
    }

    // --- inbound traffic (no lock: payloads may arrive from any provider thread) ---

    private void onPayload(long gen, String payload) {
        if (gen != generation) {
            LOG.debug("Dropping payload from a discarded channel");
            return;
        }
        ConnectionStatus current = state.status();
        if (current != ConnectionStatus.CONNECTED && current != ConnectionStatus.CONNECTING) {
            return;
        }
        ChangeEvent event;
        try {
            event = ChangePayloadParser.parse(payload);
        } catch (ChangePayloadException ex) {
            LOG.warn("Dropping change payload: {}", ex.getReason());
            return;
        }
        lastEventAt = Instant.now();
        dispatcher.dispatch(event);
    }

    // --- helpers (callers hold the lock) ---

    private boolean closeChannel() {
        ChannelHandle current = channel;
        if (current == null) {
            return false;
        }
        channel = null;
        generation++;
        try {
            provider.close(current);
        } catch (RuntimeException ex) {
            LOG.warn("Closing channel {} failed: {}", current.name(), ex.toString(), ex);
        }
        return true;
    }

    private void cancelRetry() {
        if (retryTask != null) {
            retryTask.cancel(false);
            retryTask = null;
        }
    }

    private void cancelAckTimeout() {
        if (ackTimeoutTask != null) {
            ackTimeoutTask.cancel(false);
            ackTimeoutTask = null;
        }
    }

    private void transition(ConnectionStateSnapshot next) {
        ConnectionStateSnapshot previous = state;
        if (previous.equals(next)) {
            return;
        }
        state = next;
        LOG.debug("Connection state {} -> {} (attempts={}, quality={})",
                previous.status(), next.status(), next.reconnectAttempts(), next.quality());
        List<ConnectionStateListener> recipients = List.copyOf(listeners);
        ConnectionStateChangedEvent event = new ConnectionStateChangedEvent(previous, next, Instant.now());
        notifications.add(() -> announce(recipients, event));
    }

    private void unlockAndNotify() {
        lock.unlock();
        deliverNotifications();
    }

    /**
     * Runs queued notifications in order. A thread still holding the lock (a nested
     * acquisition) leaves the work to its outermost release; a thread finding another
     * delivery in progress leaves the work to that thread.
     */
    private void deliverNotifications() {
        while (!notifications.isEmpty()) {
            if (lock.isHeldByCurrentThread() || !delivering.compareAndSet(false, true)) {
                return;
            }
            try {
                Runnable next;
                while ((next = notifications.poll()) != null) {
                    next.run();
                }
            } finally {
                delivering.set(false);
            }
        }
    }

    private void announce(List<ConnectionStateListener> recipients, ConnectionStateChangedEvent event) {
        for (ConnectionStateListener listener : recipients) {
            notifyListener(listener, event.current());
        }
        if (publisher != null) {
            try {
                publisher.publishEvent(event);
            } catch (RuntimeException ex) {
                LOG.warn("Publishing connection state change failed: {}", ex.toString(), ex);
            }
        }
    }

    private void notifyListener(ConnectionStateListener listener, ConnectionStateSnapshot snapshot) {
        // Removed since the notification was queued
        if (!listeners.contains(listener)) {
            return;
        }
        try {
            listener.onStateChanged(snapshot);
        } catch (RuntimeException ex) {
            LOG.warn("Connection listener failed: {}", ex.toString(), ex);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return (error instanceof CompletionException && error.getCause() != null) ? error.getCause() : error;
    }

    /**
     * Routes heartbeat outcomes for one connected channel back into the machine.
     */
    private final class HeartbeatHandler implements HeartbeatMonitor.Listener {

        private final long gen;

        HeartbeatHandler(long gen) {
            this.gen = gen;
        }

        @Override
        public void onHeartbeatFailed(String reason, Throwable cause) {
            lock.lock();
            try {
                if (gen == generation && state.status() == ConnectionStatus.CONNECTED) {
                    disconnected(reason, "heartbeat");
                }
            } finally {
                unlockAndNotify();
            }
        }

        @Override
        public void onStale(Duration silence) {
            lock.lock();
            try {
                if (gen != generation || state.status() != ConnectionStatus.CONNECTED) {
                    return;
                }
                LOG.warn("No change received for {}ms; reconnecting", silence.toMillis());
                health.recordFailure();
                metrics.incrementFailure("stale");
                beginAttempt(0, STALE_ERROR, ConnectionQuality.POOR);
            } finally {
                unlockAndNotify();
            }
        }
    }
}
