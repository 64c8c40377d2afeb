package com.questrail.storybridge.api;

/**
 * Thrown by non-blocking submission when a bounded queue is at capacity.
 *
 * <p>This is a transient condition. The default submission path blocks the
 * producer instead of raising it.</p>
 */
public final class QueueFullException extends RuntimeException
{
    private final int capacity;

    public QueueFullException(int capacity) {
        super("Queue is full (capacity " + capacity + ")");
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }
}
