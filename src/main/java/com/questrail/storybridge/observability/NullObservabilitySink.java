package com.questrail.storybridge.observability;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(WorkerStateTransitionEvent event) {}

    @Override
    public void onInputDiscarded(InputDiscardedEvent event) {}

    @Override
    public void onLifecycleEvent(LifecycleEvent event) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}
