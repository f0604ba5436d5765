/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC keys, set by
 * {@link com.phillippitts.realtimesync.config.logging.RealtimeRequestContextFilter}
 * for realtime endpoint requests:
 * <ul>
 *   <li>{@code requestId} - caller-supplied or generated request id</li>
 *   <li>{@code realtimeOp} - realtime operation the request triggers</li>
 *   <li>{@code channel} - shared channel name</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [thread-name] [requestId reconnect] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.realtimesync.config.ThreadPoolConfig
 */
package com.phillippitts.realtimesync.config.logging;
