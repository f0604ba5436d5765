package com.phillippitts.realtimesync.service;

/**
 * Handle returned by registrations on {@link RealtimeSubscriptionManager}.
 *
 * <p>{@link #remove()} is idempotent. Usable in try-with-resources.
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {

    void remove();

    @Override
    default void close() {
        remove();
    }
}
