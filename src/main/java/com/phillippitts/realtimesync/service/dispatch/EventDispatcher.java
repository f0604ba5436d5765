package com.phillippitts.realtimesync.service.dispatch;

import com.phillippitts.realtimesync.domain.ChangeEvent;
import com.phillippitts.realtimesync.domain.Subscription;
import com.phillippitts.realtimesync.service.metrics.RealtimeMetrics;
import com.phillippitts.realtimesync.service.registry.SubscriptionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Routes change events to every matching subscription.
 *
 * <p>Callbacks are handed out in registration order. Each is isolated: an exception is
 * logged and counted, never propagated, and never stops delivery to the remaining
 * subscriptions.
 *
 * <p>With a positive {@code callbackTimeoutMs} each callback runs on the callback executor and
 * the dispatcher waits at most that long before moving on. Every subscription owns a serial
 * lane: while one of its callbacks is still running, later events for that subscription queue
 * behind it and run in arrival order, without holding up any other subscription. When the
 * executor is saturated and runs the task on the submitting thread, the dispatching thread
 * absorbs the callback itself. With {@code 0} callbacks run inline on the dispatching thread.
 *
 * <p>A callback only runs while its subscription is still registered. {@link #awaitIdle()}
 * waits for callbacks already running, so once a subscription is gone and the wait returns
 * it receives nothing further.
 *
 * <p>Poll cues bypass filter matching: every subscription receives one cue addressed to its
 * own schema and table.
 */
public class EventDispatcher {

    private static final Logger LOG = LogManager.getLogger(EventDispatcher.class);

    // Wait bound for awaitIdle() when callbacks run inline
    private static final long INLINE_IDLE_WAIT_MS = 5_000;

    private final SubscriptionRegistry registry;
    private final Executor callbackExecutor;
    private final long callbackTimeoutMs;
    private final RealtimeMetrics metrics;

    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();

    // Callbacks hold the read side; awaitIdle() takes the write side
    private final ReentrantReadWriteLock gate = new ReentrantReadWriteLock();

    public EventDispatcher(SubscriptionRegistry registry,
                           Executor callbackExecutor,
                           long callbackTimeoutMs,
                           RealtimeMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
        this.callbackTimeoutMs = callbackTimeoutMs;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Delivers a change event to every subscription whose filter matches it.
     *
     * @param event inbound change event
     * @return number of callbacks the event was handed to
     */
    public int dispatch(ChangeEvent event) {
        int delivered = 0;
        for (Subscription subscription : registry.snapshot()) {
            if (subscription.filter().matches(event)) {
                invoke(subscription, event);
                delivered++;
            }
        }
        if (delivered == 0) {
            LOG.debug("No subscription matched {} on {}.{}", event.eventType(), event.schema(), event.table());
        } else {
            metrics.recordDispatch(delivered);
        }
        pruneLanes();
        return delivered;
    }

    /**
     * Delivers one {@code POLL_UPDATE} cue to every subscription.
     *
     * @return number of subscriptions that received a cue
     */
    public int deliverPollCues() {
        List<Subscription> subscriptions = registry.snapshot();
        for (Subscription subscription : subscriptions) {
            invoke(subscription, ChangeEvent.pollUpdate(subscription.filter().schema(), subscription.filter().table()));
        }
        if (!subscriptions.isEmpty()) {
            metrics.recordPollCues(subscriptions.size());
        }
        pruneLanes();
        return subscriptions.size();
    }

    /**
     * Waits until no callback is running.
     *
     * <p>Returns at once when called from inside a callback. Waits at most the callback budget
     * (or five seconds when callbacks run inline); a callback still running after that is
     * logged and left alone.
     */
    public void awaitIdle() {
        if (gate.getReadHoldCount() > 0) {
            return;
        }
        long boundMs = callbackTimeoutMs > 0 ? callbackTimeoutMs : INLINE_IDLE_WAIT_MS;
        try {
            if (gate.writeLock().tryLock(boundMs, TimeUnit.MILLISECONDS)) {
                gate.writeLock().unlock();
            } else {
                LOG.warn("Callbacks still running after {}ms; not waiting any longer", boundMs);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for running callbacks");
        }
    }

    private void invoke(Subscription subscription, ChangeEvent event) {
        if (callbackTimeoutMs <= 0) {
            runGated(subscription, event);
        } else {
            invokeBounded(subscription, event);
        }
    }

    private void invokeBounded(Subscription subscription, ChangeEvent event) {
        Lane lane = laneFor(subscription);
        CompletableFuture<Void> call;
        boolean busy;
        synchronized (lane) {
            busy = !lane.tail.isDone();
            call = lane.tail.thenRunAsync(() -> runGated(subscription, event), callbackExecutor);
            lane.tail = call;
        }
        if (busy) {
            LOG.debug("Subscription {} still busy; {} queued behind its running callback",
                    subscription.id(), event.eventType());
            return;
        }
        try {
            call.get(callbackTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            metrics.incrementCallbackFailure("timeout");
            LOG.warn("Subscription {} callback exceeded {}ms budget for {}; continuing with remaining subscriptions",
                    subscription.id(), callbackTimeoutMs, event.eventType());
        } catch (ExecutionException ex) {
            onCallbackError(subscription, event, ex.getCause() != null ? ex.getCause() : ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while delivering {} to {}", event.eventType(), subscription.id());
        }
    }

    private void runGated(Subscription subscription, ChangeEvent event) {
        gate.readLock().lock();
        try {
            if (!isRegistered(subscription)) {
                LOG.debug("Subscription {} no longer registered; dropping {}", subscription.id(), event.eventType());
                return;
            }
            subscription.callback().accept(event);
        } catch (RuntimeException ex) {
            onCallbackError(subscription, event, ex);
        } finally {
            gate.readLock().unlock();
        }
    }

    private boolean isRegistered(Subscription subscription) {
        return registry.get(subscription.id()).filter(current -> current == subscription).isPresent();
    }

    private Lane laneFor(Subscription subscription) {
        return lanes.compute(subscription.id(),
                (id, lane) -> lane == null || lane.subscription != subscription ? new Lane(subscription) : lane);
    }

    private void pruneLanes() {
        lanes.values().removeIf(lane -> lane.isIdle() && !isRegistered(lane.subscription));
    }

    private void onCallbackError(Subscription subscription, ChangeEvent event, Throwable error) {
        metrics.incrementCallbackFailure("error");
        LOG.warn("Subscription {} callback failed for {} on {}.{}: {}",
                subscription.id(), event.eventType(), event.schema(), event.table(), error.toString(), error);
    }

    /** Tail of the callbacks handed to one subscription. */
    private static final class Lane {

        private final Subscription subscription;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        private Lane(Subscription subscription) {
            this.subscription = subscription;
        }

        private synchronized boolean isIdle() {
            return tail.isDone();
        }
    }
}
