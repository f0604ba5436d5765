package com.phillippitts.realtimesync.exception;

/**
 * Thrown when the channel provider fails to open or subscribe a channel.
 * Retried with backoff until attempts are exhausted.
 */
public class ChannelOpenException extends RealtimeSyncException {

    private final String channelName;

    public ChannelOpenException(String channelName, Throwable cause) {
        super("Failed to open realtime channel " + channelName + describe(cause), cause);
        this.channelName = channelName;
    }

    public String getChannelName() {
        return channelName;
    }

    private static String describe(Throwable cause) {
        if (cause == null || cause.getMessage() == null) {
            return "";
        }
        return ": " + cause.getMessage();
    }
}
