package com.questrail.storybridge.observability;

/**
 * Main interface for receiving story bridge observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive on the engine worker thread, on producer threads
 * or on the lifecycle caller's thread. Implementations must be thread-safe
 * and must return quickly.</p>
 */
public interface BridgeObservabilitySink {
    /**
     * Called when the engine worker changes state.
     * @param event the transition details
     */
    void onStateTransition(WorkerStateTransitionEvent event);

    /**
     * Called when submitted input is discarded instead of enqueued or
     * delivered (malformed text, overflow under the drop policy, cancelled
     * or abandoned commands).
     * @param event the discarded input
     */
    void onInputDiscarded(InputDiscardedEvent event);

    /**
     * Called at lifecycle milestones (startup, shutdown escalation).
     * @param event the lifecycle event
     */
    void onLifecycleEvent(LifecycleEvent event);

    /**
     * Called when an error reaches a component boundary.
     * @param event the error event
     */
    void onError(BridgeErrorEvent event);
}
