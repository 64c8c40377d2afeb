package com.questrail.storybridge.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for lifecycle timeout budgets.
 *
 * <h2>Binding invariant</h2>
 * Startup and shutdown deadlines MUST be computed from a monotonic source.
 * Wall-clock time (e.g. {@code Instant.now()}) is permitted only for
 * observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
