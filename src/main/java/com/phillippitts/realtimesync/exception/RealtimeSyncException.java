package com.phillippitts.realtimesync.exception;

/**
 * Base exception for all realtime-sync application errors.
 * Transport failures are modelled as subclasses so they can be logged and folded into
 * connection state without leaking to subscribers.
 */
public class RealtimeSyncException extends RuntimeException {

    public RealtimeSyncException(String message) {
        super(message);
    }

    public RealtimeSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public RealtimeSyncException(Throwable cause) {
        super(cause);
    }
}
