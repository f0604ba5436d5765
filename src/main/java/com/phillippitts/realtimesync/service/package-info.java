/**
 * Service layer of the realtime subscription manager.
 *
 * <p>{@link com.phillippitts.realtimesync.service.RealtimeSubscriptionManager} is the only
 * entry point consumers use. Sub-packages:
 * <ul>
 *   <li>{@code service.connection} - connection state machine and heartbeat</li>
 *   <li>{@code service.channel} - channel provider boundary, payload parsing, loopback provider</li>
 *   <li>{@code service.dispatch} - event routing and the polling fallback</li>
 *   <li>{@code service.registry} - subscription bookkeeping</li>
 *   <li>{@code service.backoff}, {@code service.health}, {@code service.metrics} - reconnect
 *       pacing, health statistics and Micrometer counters</li>
 * </ul>
 *
 * <p>Collaborators are plain objects wired in
 * {@link com.phillippitts.realtimesync.config.realtime.RealtimeConfig}; tests construct them
 * directly without a Spring context.
 */
package com.phillippitts.realtimesync.service;
