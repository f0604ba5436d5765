package com.phillippitts.realtimesync.service.connection;

import com.phillippitts.realtimesync.domain.ConnectionStateSnapshot;

/**
 * Receives connection state snapshots.
 *
 * <p>Called once with the current snapshot on registration, then after every transition that
 * changes the snapshot. Calls happen synchronously, in transition order, while the state
 * machine holds its lock: implementations must be quick and must not block.
 */
@FunctionalInterface
public interface ConnectionStateListener {

    void onStateChanged(ConnectionStateSnapshot state);
}
