package com.phillippitts.realtimesync.service.events;

import com.phillippitts.realtimesync.domain.ConnectionStateSnapshot;
import com.phillippitts.realtimesync.service.connection.event.ConnectionStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing summary of connection trouble. Throttled so a flapping channel does not spam the log.
 */
@Component
class ConnectionEventsListener {
    private static final Logger LOG = LogManager.getLogger(ConnectionEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onStateChanged(ConnectionStateChangedEvent e) {
        ConnectionStateSnapshot current = e.current();
        switch (current.status()) {
            case RECONNECTING -> {
                if (shouldLog("reconnecting")) {
                    LOG.warn("Realtime channel degraded: reconnecting (attempt {}/{}), lastError={}",
                            current.reconnectAttempts(), current.maxReconnectAttempts(), current.lastError());
                }
            }
            case POLLING -> {
                if (shouldLog("polling")) {
                    LOG.warn("Realtime channel down; consumers receive periodic POLL_UPDATE cues. lastError={}",
                            current.lastError());
                }
            }
            case FAILED -> {
                if (shouldLog("failed")) {
                    LOG.warn("Realtime channel failed; use POST /api/v1/realtime/reconnect to retry. lastError={}",
                            current.lastError());
                }
            }
            case CONNECTED -> {
                // A connecting snapshot that still carries an error is a retry
                if (e.previous().lastError() != null) {
                    LOG.info("Realtime channel recovered after: {}", e.previous().lastError());
                }
            }
            default -> {
                // IDLE and CONNECTING are routine
            }
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
