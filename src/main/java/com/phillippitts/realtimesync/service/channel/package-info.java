/**
 * Boundary to the realtime transport.
 *
 * <p>{@link com.phillippitts.realtimesync.service.channel.ChannelProvider} and
 * {@link com.phillippitts.realtimesync.service.channel.ChannelHandle} are implemented by
 * transports; the manager only consumes them.
 */
package com.phillippitts.realtimesync.service.channel;
