package com.questrail.storybridge.observability;

import com.questrail.storybridge.internal.exec.WorkerState;

import java.time.Instant;

/**
 * Record representing a state transition of the engine worker.
 */
public record WorkerStateTransitionEvent(
    Instant timestamp,
    WorkerState oldState,
    WorkerState newState,
    String reason
) {
    /**
     * Checks whether the worker has reached its final state.
     */
    public boolean isTerminal() {
        return newState == WorkerState.STOPPED;
    }
}
