package com.phillippitts.realtimesync.service.channel;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * One open channel obtained from a {@link ChannelProvider}.
 *
 * <p>Implementations may invoke the registered handlers from any thread, including
 * synchronously from within {@link #subscribe(Consumer)}.
 */
public interface ChannelHandle {

    /** Name the channel was opened with. */
    String name();

    /**
     * Registers the handler for raw change payloads (JSON text) inside the given scope.
     *
     * @param scope          schema/table filter applied by the transport
     * @param payloadHandler receives every raw payload
     */
    void onChange(ChannelScope scope, Consumer<String> payloadHandler);

    /**
     * Starts the subscription. {@link ChannelStatus#SUBSCRIBED} on {@code statusListener} is
     * the acknowledgement; later failure statuses signal a lost channel.
     *
     * @param statusListener receives every status change
     * @return future that completes exceptionally if the request could not be sent
     */
    CompletableFuture<Void> subscribe(Consumer<ChannelStatus> statusListener);

    /**
     * Sends a message over the channel.
     *
     * @param message serialized message
     * @throws RuntimeException if the channel can no longer send
     */
    void send(String message);

    /** Provider-defined channel state, e.g. {@code "joined"} or {@code "closed"}. */
    String state();
}
