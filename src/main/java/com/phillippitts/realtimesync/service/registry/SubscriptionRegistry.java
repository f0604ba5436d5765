package com.phillippitts.realtimesync.service.registry;

import com.phillippitts.realtimesync.domain.Subscription;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keyed collection of subscriptions, iterated in registration order.
 *
 * <p>Ids are unique: adding an id that is already present leaves the existing entry in place.
 *
 * <p><b>Thread Safety:</b> All public methods are thread-safe and use a {@link ReentrantLock}.
 * {@link #snapshot()} returns a copy, so dispatching never holds the lock while callbacks run.
 */
public class SubscriptionRegistry {

    private final Lock lock = new ReentrantLock();
    private final Map<String, Subscription> entries = new LinkedHashMap<>();

    /**
     * Registers a subscription unless its id is taken.
     *
     * @param subscription subscription to add
     * @return {@code true} if added, {@code false} if the id already existed
     */
    public boolean add(Subscription subscription) {
        lock.lock();
        try {
            return entries.putIfAbsent(subscription.id(), subscription) == null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a subscription.
     *
     * @param id subscription id
     * @return {@code true} if an entry was removed
     */
    public boolean remove(String id) {
        lock.lock();
        try {
            return entries.remove(id) != null;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Subscription> get(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(id));
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return entries.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the current subscriptions in registration order.
     */
    public List<Subscription> snapshot() {
        lock.lock();
        try {
            return List.copyOf(entries.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every subscription.
     *
     * @return number of subscriptions removed
     */
    public int clear() {
        lock.lock();
        try {
            int removed = entries.size();
            entries.clear();
            return removed;
        } finally {
            lock.unlock();
        }
    }
}
