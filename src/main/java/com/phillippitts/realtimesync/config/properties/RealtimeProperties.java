package com.phillippitts.realtimesync.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the realtime subscription manager.
 *
 * <p>Note: Bean created via {@link com.phillippitts.realtimesync.RealtimeSyncApplication#EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "realtime")
@Validated
public class RealtimeProperties {

    /** Consecutive failed attempts before live reconnection is abandoned. */
    @Positive(message = "Max reconnect attempts must be positive")
    private int maxReconnectAttempts = 5;

    /** When attempts run out: true falls back to polling, false stops in FAILED. */
    private boolean fallbackToPolling = true;

    /** Maximum wait for the provider's subscription acknowledgement. */
    @Positive(message = "Subscribe timeout must be positive")
    private long subscribeTimeoutMs = 10_000;

    /** Heartbeat period while connected. */
    @Positive(message = "Heartbeat interval must be positive")
    private long heartbeatIntervalMs = 30_000;

    /** Period of POLL_UPDATE cues while in polling fallback. */
    @Positive(message = "Poll interval must be positive")
    private long pollIntervalMs = 30_000;

    /** Reconnect when connected but no change arrived for this long; 0 disables. */
    @Min(0)
    private long staleThresholdMs = 0;

    /** Execution budget per consumer callback; 0 runs callbacks inline without a bound. */
    @Min(0)
    private long callbackTimeoutMs = 5_000;

    /** Channel provider selection ("loopback" wires the in-process provider). */
    private String provider = "loopback";

    @Valid
    private Backoff backoff = new Backoff();

    @Valid
    private Channel channel = new Channel();

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public void setMaxReconnectAttempts(int maxReconnectAttempts) {
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    public boolean isFallbackToPolling() {
        return fallbackToPolling;
    }

    public void setFallbackToPolling(boolean fallbackToPolling) {
        this.fallbackToPolling = fallbackToPolling;
    }

    public long getSubscribeTimeoutMs() {
        return subscribeTimeoutMs;
    }

    public void setSubscribeTimeoutMs(long subscribeTimeoutMs) {
        this.subscribeTimeoutMs = subscribeTimeoutMs;
    }

    public long getHeartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
        this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public long getStaleThresholdMs() {
        return staleThresholdMs;
    }

    public void setStaleThresholdMs(long staleThresholdMs) {
        this.staleThresholdMs = staleThresholdMs;
    }

    public long getCallbackTimeoutMs() {
        return callbackTimeoutMs;
    }

    public void setCallbackTimeoutMs(long callbackTimeoutMs) {
        this.callbackTimeoutMs = callbackTimeoutMs;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public void setBackoff(Backoff backoff) {
        this.backoff = backoff;
    }

    public Channel getChannel() {
        return channel;
    }

    public void setChannel(Channel channel) {
        this.channel = channel;
    }

    /**
     * Reconnect backoff: {@code min(base * 2^attempt, cap) + uniform[0, jitter)}.
     */
    public static class Backoff {

        @Positive(message = "Backoff base delay must be positive")
        private long baseDelayMs = 1_000;

        @Positive(message = "Backoff cap delay must be positive")
        private long capDelayMs = 30_000;

        @Min(0)
        private long jitterMs = 1_000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getCapDelayMs() {
            return capDelayMs;
        }

        public void setCapDelayMs(long capDelayMs) {
            this.capDelayMs = capDelayMs;
        }

        public long getJitterMs() {
            return jitterMs;
        }

        public void setJitterMs(long jitterMs) {
            this.jitterMs = jitterMs;
        }
    }

    /**
     * Name and fixed scope of the shared channel.
     */
    public static class Channel {

        @NotBlank
        private String name = "consolidated-realtime-channel";

        @NotBlank
        private String schema = "public";

        /** {@code *} watches every table in the schema. */
        @NotBlank
        private String table = "*";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getSchema() {
            return schema;
        }

        public void setSchema(String schema) {
            this.schema = schema;
        }

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }
    }
}
