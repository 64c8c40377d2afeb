package com.questrail.storybridge.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the story bridge.
 */
public record BridgeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
