/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.realtimesync.exception.RealtimeSyncException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.realtimesync.exception.ChannelOpenException} - The provider could
 *       not open or subscribe the channel</li>
 *   <li>{@link com.phillippitts.realtimesync.exception.SubscribeTimeoutException} - No subscription
 *       acknowledgement within the configured timeout</li>
 *   <li>{@link com.phillippitts.realtimesync.exception.ChannelClosedException} - The provider
 *       reported the channel closed, errored or timed out</li>
 *   <li>{@link com.phillippitts.realtimesync.exception.ChangePayloadException} - A raw change
 *       payload could not be parsed</li>
 * </ul>
 *
 * <p>None of these reach subscribers. The connection state machine logs them and turns them
 * into state transitions and health counters, so none of them reaches the REST boundary
 * either.
 *
 * @since 1.0
 */
package com.phillippitts.realtimesync.exception;
