package com.questrail.storybridge.api;

/**
 * Thrown when a queue or channel is used after it has been closed.
 * This is terminal: the bridge is shutting down or has shut down.
 */
public final class QueueClosedException extends RuntimeException
{
    public QueueClosedException(String message) {
        super(message);
    }
}
