package com.phillippitts.realtimesync.config.realtime;

import com.phillippitts.realtimesync.config.properties.RealtimeProperties;
import com.phillippitts.realtimesync.service.RealtimeSubscriptionManager;
import com.phillippitts.realtimesync.service.backoff.BackoffScheduler;
import com.phillippitts.realtimesync.service.channel.ChannelProvider;
import com.phillippitts.realtimesync.service.channel.loopback.LoopbackChannelProvider;
import com.phillippitts.realtimesync.service.connection.ConnectionStateMachine;
import com.phillippitts.realtimesync.service.connection.HeartbeatMonitor;
import com.phillippitts.realtimesync.service.dispatch.EventDispatcher;
import com.phillippitts.realtimesync.service.dispatch.PollingFallbackDriver;
import com.phillippitts.realtimesync.service.health.ConnectionHealthTracker;
import com.phillippitts.realtimesync.service.metrics.RealtimeMetrics;
import com.phillippitts.realtimesync.service.registry.SubscriptionRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the realtime subscription manager and its collaborators.
 *
 * <p>Every collaborator is a plain object; this class is the only place that knows how they
 * fit together. A real transport is plugged in by declaring a {@link ChannelProvider} bean
 * and setting {@code realtime.provider} to anything other than {@code loopback}.
 */
@Configuration
public class RealtimeConfig {

    private final RealtimeProperties props;
    private final RealtimeMetrics metrics;
    private final ScheduledExecutorService scheduler;

    public RealtimeConfig(RealtimeProperties props,
                          RealtimeMetrics metrics,
                          @Qualifier("realtimeScheduler") ThreadPoolTaskScheduler realtimeScheduler) {
        this.props = props;
        this.metrics = metrics;
        this.scheduler = realtimeScheduler.getScheduledExecutor();
    }

    /**
     * In-process provider used for local runs and tests.
     */
    @Bean
    @ConditionalOnProperty(prefix = "realtime", name = "provider", havingValue = "loopback", matchIfMissing = true)
    public LoopbackChannelProvider loopbackChannelProvider() {
        return new LoopbackChannelProvider();
    }

    @Bean
    public SubscriptionRegistry subscriptionRegistry() {
        return new SubscriptionRegistry();
    }

    @Bean
    public ConnectionHealthTracker connectionHealthTracker() {
        return new ConnectionHealthTracker();
    }

    @Bean
    public EventDispatcher eventDispatcher(SubscriptionRegistry registry,
                                           @Qualifier("callbackExecutor") ThreadPoolTaskExecutor callbackExecutor) {
        return new EventDispatcher(registry, callbackExecutor, props.getCallbackTimeoutMs(), metrics);
    }

    @Bean
    public PollingFallbackDriver pollingFallbackDriver(EventDispatcher dispatcher) {
        return new PollingFallbackDriver(scheduler, dispatcher, props.getPollIntervalMs());
    }

    @Bean
    public HeartbeatMonitor heartbeatMonitor() {
        return new HeartbeatMonitor(scheduler, props.getHeartbeatIntervalMs(), props.getStaleThresholdMs());
    }

    @Bean
    public ConnectionStateMachine connectionStateMachine(ChannelProvider provider,
                                                         EventDispatcher dispatcher,
                                                         ConnectionHealthTracker health,
                                                         HeartbeatMonitor heartbeat,
                                                         PollingFallbackDriver polling,
                                                         ApplicationEventPublisher publisher) {
        return new ConnectionStateMachine(provider, props, dispatcher, health,
                BackoffScheduler.from(props.getBackoff()), heartbeat, polling, scheduler, metrics, publisher);
    }

    @Bean
    public RealtimeSubscriptionManager realtimeSubscriptionManager(SubscriptionRegistry registry,
                                                                   ConnectionStateMachine connection,
                                                                   EventDispatcher dispatcher,
                                                                   ConnectionHealthTracker health) {
        return new RealtimeSubscriptionManager(registry, connection, dispatcher, health);
    }
}
