package com.phillippitts.realtimesync.service.channel;

/**
 * Transport that opens and closes realtime channels.
 *
 * <p>Consumed, not implemented, by the subscription manager. Authentication and the wire
 * protocol are the provider's business.
 */
public interface ChannelProvider {

    /**
     * Opens a new channel.
     *
     * @param channelName logical channel name
     * @return handle for the new channel
     * @throws RuntimeException if the transport cannot create the channel
     */
    ChannelHandle open(String channelName);

    /**
     * Closes a channel previously returned by {@link #open(String)} and drops its handlers.
     *
     * @param handle channel to close
     */
    void close(ChannelHandle handle);
}
