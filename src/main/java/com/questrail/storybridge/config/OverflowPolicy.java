package com.questrail.storybridge.config;

/**
 * What a producer does when the command queue is at capacity.
 */
public enum OverflowPolicy
{
    /** Block the producer until space is available (backpressure). */
    BLOCK,

    /** Discard the submitted line and report it; the producer never blocks. */
    DROP
}
