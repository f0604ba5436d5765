package com.phillippitts.realtimesync.service;

import com.phillippitts.realtimesync.domain.ChangeEvent;
import com.phillippitts.realtimesync.domain.ConnectionStateSnapshot;
import com.phillippitts.realtimesync.domain.EventFilter;
import com.phillippitts.realtimesync.domain.HealthStatus;
import com.phillippitts.realtimesync.domain.Subscription;
import com.phillippitts.realtimesync.service.connection.ConnectionStateListener;
import com.phillippitts.realtimesync.service.connection.ConnectionStateMachine;
import com.phillippitts.realtimesync.service.dispatch.EventDispatcher;
import com.phillippitts.realtimesync.service.health.ConnectionHealthTracker;
import com.phillippitts.realtimesync.service.registry.SubscriptionRegistry;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Public surface of the realtime subscription manager.
 *
 * <p>Consumers register {@link Subscription}s; every subscription shares one underlying
 * channel that is opened with the first subscription and closed when the last one leaves.
 * Transport failures never reach callers: they surface as connection state transitions
 * (see {@link #addConnectionListener}) and in {@link #getHealthStatus()}.
 *
 * <p>Usage:
 * <pre>{@code
 * Registration leads = manager.subscribe("leads-view",
 *         EventFilter.of("*", "public", "leads"),
 *         event -> refresh(event));
 * ...
 * leads.remove();
 * }</pre>
 *
 * <p>Thread-safe. {@code subscribe} and {@code unsubscribe} never block on the network;
 * connection establishment happens in the background.
 */
public class RealtimeSubscriptionManager {

    private static final Logger LOG = LogManager.getLogger(RealtimeSubscriptionManager.class);

    private final SubscriptionRegistry registry;
    private final ConnectionStateMachine connection;
    private final EventDispatcher dispatcher;
    private final ConnectionHealthTracker health;

    // Serializes membership changes with the connect/teardown decisions they trigger
    private final Lock membershipLock = new ReentrantLock();

    public RealtimeSubscriptionManager(SubscriptionRegistry registry,
                                       ConnectionStateMachine connection,
                                       EventDispatcher dispatcher,
                                       ConnectionHealthTracker health) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.health = Objects.requireNonNull(health, "health");
    }

    /**
     * Registers a subscription and makes sure the shared channel is being established.
     *
     * <p>Subscribing with an id that is already registered keeps the existing subscription
     * and returns a handle for it.
     *
     * @param subscription subscription to register
     * @return handle that unsubscribes the id
     */
    public Registration subscribe(Subscription subscription) {
        Objects.requireNonNull(subscription, "subscription must not be null");
        membershipLock.lock();
        try {
            if (registry.add(subscription)) {
                LOG.info("Subscription added: id={}, filter={}", subscription.id(), subscription.filter());
            } else {
                LOG.debug("Subscription {} already registered; keeping the existing one", subscription.id());
            }
            connection.ensureConnected();
        } finally {
            membershipLock.unlock();
        }
        String id = subscription.id();
        return () -> unsubscribe(id);
    }

    /**
     * Convenience overload of {@link #subscribe(Subscription)}.
     */
    public Registration subscribe(String id, EventFilter filter, Consumer<ChangeEvent> callback) {
        return subscribe(new Subscription(id, filter, callback));
    }

    /**
     * Removes a subscription. Removing the last one tears the channel down.
     *
     * @param id subscription id
     * @return {@code true} if the id was registered
     */
    public boolean unsubscribe(String id) {
        membershipLock.lock();
        try {
            boolean removed = registry.remove(id);
            if (removed) {
                LOG.info("Subscription removed: id={}", id);
                if (registry.isEmpty()) {
                    LOG.info("No subscriptions left; closing realtime channel");
                    connection.teardown();
                }
            }
            return removed;
        } finally {
            membershipLock.unlock();
        }
    }

    /**
     * Registers a connection listener. It is called right away with the current snapshot,
     * then after every state change.
     *
     * @return handle that removes the listener
     */
    public Registration addConnectionListener(ConnectionStateListener listener) {
        return connection.addListener(listener);
    }

    /**
     * Reconnects immediately, without backoff, from any status. Does nothing while there
     * are no subscriptions.
     */
    public void forceReconnect() {
        if (registry.isEmpty()) {
            LOG.debug("Forced reconnect ignored: no subscriptions");
            return;
        }
        connection.forceReconnect();
    }

    /**
     * Delivers one {@code POLL_UPDATE} cue to every subscription right away.
     *
     * @return number of subscriptions cued
     */
    public int forceSync() {
        int cued = dispatcher.deliverPollCues();
        LOG.info("Manual sync cued {} subscription(s)", cued);
        return cued;
    }

    public ConnectionStateSnapshot getConnectionState() {
        return connection.getState();
    }

    public HealthStatus getHealthStatus() {
        ConnectionHealthTracker.Metrics m = health.status();
        return new HealthStatus(
                m.attempts(),
                m.successes(),
                m.failures(),
                m.consecutiveFailures(),
                m.successRate(),
                m.isHealthy(),
                registry.size(),
                connection.channelState(),
                connection.getState().status(),
                m.lastAttemptAt(),
                m.lastSuccessAt(),
                m.lastFailureAt());
    }

    /**
     * Drops every subscription and listener, cancels all timers and closes the channel, then
     * waits for callbacks that were already running. No callback starts after this returns.
     * Idempotent; the manager can be used again afterwards.
     */
    @PreDestroy
    public void cleanup() {
        membershipLock.lock();
        try {
            int removed = registry.clear();
            connection.teardown();
            connection.clearListeners();
            if (removed > 0) {
                LOG.info("Realtime manager cleaned up ({} subscription(s) dropped)", removed);
            }
        } finally {
            membershipLock.unlock();
        }
        dispatcher.awaitIdle();
    }
}
