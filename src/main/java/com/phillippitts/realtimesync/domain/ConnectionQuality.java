package com.phillippitts.realtimesync.domain;

/**
 * Coarse quality rating attached to connection snapshots for display and alerting.
 */
public enum ConnectionQuality {
    EXCELLENT,
    GOOD,
    POOR,
    CRITICAL
}
