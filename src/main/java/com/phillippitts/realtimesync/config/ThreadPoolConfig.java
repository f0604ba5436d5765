package com.phillippitts.realtimesync.config;

import com.phillippitts.realtimesync.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind the realtime channel.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the scheduler that owns every realtime timer: connect requests, backoff retries,
     * acknowledgement timeouts, heartbeats and polling ticks.
     *
     * <p>A single thread (the default) keeps timer callbacks strictly ordered. Cancelled tasks
     * are removed from the queue immediately because acknowledgement timeouts are cancelled
     * on almost every successful connect.
     *
     * @return Configured scheduler for realtime timers
     */
    @Bean(name = "realtimeScheduler")
    public ThreadPoolTaskScheduler realtimeScheduler() {
        ThreadPoolProperties.SchedulerPoolProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Creates the pool that runs consumer callbacks under their execution budget.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.callback.*} properties:
     * <ul>
     *   <li>Core pool: default 2 - one event in flight plus a lingering slow callback</li>
     *   <li>Max pool: default 8 - absorbs several callbacks overrunning their budget</li>
     *   <li>Queue: default 100 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the dispatching thread runs the callback itself,
     * providing backpressure instead of dropping events. Submissions are therefore never
     * rejected, and a callback run this way holds the dispatching thread for its whole run.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the dispatching thread to
     * the worker thread so callback logs keep their correlation IDs.
     *
     * @return Configured executor for consumer callbacks
     */
    @Bean(name = "callbackExecutor")
    public ThreadPoolTaskExecutor callbackExecutor() {
        ThreadPoolProperties.CallbackPoolProperties props = threadPoolProperties.getCallback();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext into the task and restores the worker's
     * own context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
