package com.phillippitts.realtimesync.service.channel;

/**
 * Subscription status values reported by a channel provider.
 */
public enum ChannelStatus {
    SUBSCRIBED,
    CLOSED,
    CHANNEL_ERROR,
    TIMED_OUT;

    /** True for every status that means the channel is unusable. */
    public boolean isFailure() {
        return this != SUBSCRIBED;
    }

    /**
     * Human-readable description recorded as the connection's last error.
     */
    public String describe() {
        return switch (this) {
            case SUBSCRIBED -> "Channel subscribed";
            case CLOSED -> "Connection closed unexpectedly";
            case CHANNEL_ERROR -> "Channel error occurred";
            case TIMED_OUT -> "Connection timed out";
        };
    }
}
