package com.questrail.storybridge.api;

/**
 * Raised for introspection requests that can no longer be serviced because
 * the engine worker is stopping or has stopped.
 */
public final class WorkerStoppedException extends RuntimeException
{
    public WorkerStoppedException(String message) {
        super(message);
    }
}
