package com.phillippitts.realtimesync.exception;

import com.phillippitts.realtimesync.service.channel.ChannelStatus;

/**
 * Raised when the provider reports {@code CLOSED}, {@code CHANNEL_ERROR} or {@code TIMED_OUT}.
 */
public class ChannelClosedException extends RealtimeSyncException {

    private final ChannelStatus status;

    public ChannelClosedException(ChannelStatus status) {
        super(status.describe());
        this.status = status;
    }

    public ChannelStatus getStatus() {
        return status;
    }
}
