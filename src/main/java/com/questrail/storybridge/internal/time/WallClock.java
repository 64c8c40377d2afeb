package com.questrail.storybridge.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability timestamps.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It MUST NOT be used to compute timeouts.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
