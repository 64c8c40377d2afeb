package com.questrail.storybridge.runtime;

/**
 * How a {@link LifecycleController#shutdown()} call ended.
 */
public enum ShutdownOutcome {
    /** {@code start()} was never called; the queues were closed directly. */
    NEVER_STARTED,

    /** The worker had already stopped on its own (story ended or fatal error). */
    ALREADY_STOPPED,

    /** The worker serviced the quit directive within the shutdown timeout. */
    GRACEFUL,

    /** The quit directive timed out; the worker stopped after being interrupted. */
    FORCED,

    /** The worker ignored the interrupt as well and is still alive. */
    UNRESPONSIVE
}
