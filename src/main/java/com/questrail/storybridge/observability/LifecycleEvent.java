package com.questrail.storybridge.observability;

import java.time.Instant;

/**
 * Record representing a lifecycle milestone of the bridge runtime.
 */
public record LifecycleEvent(
    Instant timestamp,
    Phase phase,
    String detail
) {
    public enum Phase {
        STARTED,
        SHUTDOWN_REQUESTED,
        FORCE_STOP_REQUESTED,
        SHUTDOWN_COMPLETE
    }
}
