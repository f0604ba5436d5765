package com.phillippitts.realtimesync.exception;

/**
 * Thrown when a raw change payload cannot be turned into a change event.
 * The offending payload is dropped; the channel stays up.
 */
public class ChangePayloadException extends RealtimeSyncException {

    private final String reason;

    public ChangePayloadException(String reason) {
        super("Malformed change payload: " + reason);
        this.reason = reason;
    }

    public ChangePayloadException(String reason, Throwable cause) {
        super("Malformed change payload: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
