package com.questrail.storybridge.observability;

import com.questrail.storybridge.api.CommandSource;

import java.time.Instant;

/**
 * Record representing a line of input that never reached the engine.
 */
public record InputDiscardedEvent(
    Instant timestamp,
    CommandSource source,
    String text,
    String reason
) {
}
