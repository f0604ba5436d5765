package com.phillippitts.realtimesync.service.channel.loopback;

import com.phillippitts.realtimesync.service.channel.ChannelHandle;
import com.phillippitts.realtimesync.service.channel.ChannelProvider;
import com.phillippitts.realtimesync.service.channel.ChannelScope;
import com.phillippitts.realtimesync.service.channel.ChannelStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process channel provider for local runs and tests.
 *
 * <p>Channels acknowledge immediately. Host code feeds raw change payloads with
 * {@link #publish(String)}; they are delivered to every open channel whose scope covers the
 * payload's schema and table.
 */
public class LoopbackChannelProvider implements ChannelProvider {

    private static final Logger LOG = LogManager.getLogger(LoopbackChannelProvider.class);

    private final List<LoopbackChannel> open = new CopyOnWriteArrayList<>();

    @Override
    public ChannelHandle open(String channelName) {
        LoopbackChannel channel = new LoopbackChannel(channelName);
        open.add(channel);
        LOG.debug("Loopback channel opened: {}", channelName);
        return channel;
    }

    @Override
    public void close(ChannelHandle handle) {
        if (handle instanceof LoopbackChannel channel) {
            channel.closed = true;
            open.remove(channel);
            LOG.debug("Loopback channel closed: {}", channel.name());
        }
    }

    /**
     * Delivers a raw change payload to every open channel covering its table.
     *
     * @param rawPayload JSON change payload
     * @return number of channels the payload was handed to
     */
    public int publish(String rawPayload) {
        JSONObject obj = new JSONObject(rawPayload);
        String schema = obj.optString("schema", "");
        String table = obj.optString("table", "");
        int delivered = 0;
        for (LoopbackChannel channel : open) {
            if (channel.deliver(schema, table, rawPayload)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Reports a status on every open channel, e.g. to simulate a dropped link.
     */
    public void emitStatus(ChannelStatus status) {
        for (LoopbackChannel channel : open) {
            channel.emit(status);
        }
    }

    /** Number of channels currently open. */
    public int openChannels() {
        return open.size();
    }

    static final class LoopbackChannel implements ChannelHandle {

        private final String name;
        private final List<ScopedHandler> handlers = new CopyOnWriteArrayList<>();
        private volatile Consumer<ChannelStatus> statusListener;
        private volatile boolean subscribed;
        private volatile boolean closed;
        private volatile String lastSent;

        LoopbackChannel(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void onChange(ChannelScope scope, Consumer<String> payloadHandler) {
            handlers.add(new ScopedHandler(scope, payloadHandler));
        }

        @Override
        public CompletableFuture<Void> subscribe(Consumer<ChannelStatus> listener) {
            if (closed) {
                return CompletableFuture.failedFuture(new IllegalStateException("channel " + name + " is closed"));
            }
            this.statusListener = listener;
            this.subscribed = true;
            listener.accept(ChannelStatus.SUBSCRIBED);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void send(String message) {
            if (closed) {
                throw new IllegalStateException("channel " + name + " is closed");
            }
            lastSent = message;
        }

        @Override
        public String state() {
            if (closed) {
                return "closed";
            }
            return subscribed ? "joined" : "joining";
        }

        String lastSent() {
            return lastSent;
        }

        boolean deliver(String schema, String table, String payload) {
            if (closed || !subscribed) {
                return false;
            }
            boolean delivered = false;
            for (ScopedHandler h : handlers) {
                if (h.scope().covers(schema, table)) {
                    h.handler().accept(payload);
                    delivered = true;
                }
            }
            return delivered;
        }

        void emit(ChannelStatus status) {
            Consumer<ChannelStatus> listener = statusListener;
            if (listener != null && !closed) {
                listener.accept(status);
            }
        }
    }

    private record ScopedHandler(ChannelScope scope, Consumer<String> handler) {
    }
}
