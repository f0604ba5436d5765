package com.phillippitts.realtimesync.exception;

/**
 * Thrown when the provider does not acknowledge a channel subscription in time.
 * Handled exactly like {@link ChannelOpenException}.
 */
public class SubscribeTimeoutException extends RealtimeSyncException {

    private final long timeoutMs;

    public SubscribeTimeoutException(long timeoutMs) {
        super("Channel subscription not acknowledged within " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
