package com.questrail.storybridge.core;

import com.questrail.storybridge.api.Command;
import com.questrail.storybridge.api.CommandSource;
import com.questrail.storybridge.api.QueueClosedException;
import com.questrail.storybridge.api.QueueFullException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * PriorityCommandQueue
 * =============================================================================
 * Bounded, priority-ordered, FIFO-within-priority queue of {@link Command}s.
 * It is the only channel through which producers reach the engine worker.
 *
 * <h2>Ordering</h2>
 * Commands are held in a binary heap ordered by {@link Command#compareTo}:
 * {@code (priority desc, sequence asc)}. Sequence numbers are assigned under
 * the queue lock at the moment of insertion, so the order in which producers
 * actually got into the queue decides ties, regardless of which thread they
 * ran on.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>Any number of producer threads may enqueue concurrently.</li>
 *   <li>Exactly one consumer (the engine worker) may dequeue. Concurrent
 *       consumers are not a supported configuration.</li>
 * </ul>
 *
 * <h2>Backpressure</h2>
 * {@link #enqueue(String, CommandSource, int)} blocks while the queue is full.
 * {@link #tryEnqueue(String, CommandSource, int)} raises
 * {@link QueueFullException} instead, leaving the policy to the caller.
 *
 * <h2>Closing</h2>
 * Once {@link #close()} is called the queue discards what it holds, rejects
 * further enqueues with {@link QueueClosedException}, and releases every
 * blocked producer and the consumer with the same exception.
 */
public final class PriorityCommandQueue {

    private final int capacity;
    private final PriorityQueue<Command> heap;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private long nextSequence;
    private boolean wakeRequested;
    private boolean closed;

    public PriorityCommandQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.heap = new PriorityQueue<>(Math.min(capacity, 64));
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        lock.lock();
        try {
            return heap.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts a new command, blocking while the queue is full.
     *
     * @return the command as inserted, with its assigned sequence number
     * @throws QueueClosedException if the queue is or becomes closed
     * @throws InterruptedException if interrupted while waiting for space
     */
    public Command enqueue(String text, CommandSource source, int priority) throws InterruptedException {
        validate(text, source);
        lock.lockInterruptibly();
        try {
            while (!closed && heap.size() >= capacity) {
                notFull.await();
            }
            return insert(text, source, priority);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts a new command, waiting at most {@code timeout} for space.
     *
     * @return the inserted command, or empty if the queue was still full
     */
    public Optional<Command> enqueue(String text, CommandSource source, int priority, Duration timeout)
            throws InterruptedException {
        validate(text, source);
        Objects.requireNonNull(timeout, "timeout");
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (!closed && heap.size() >= capacity) {
                if (remaining <= 0L) {
                    return Optional.empty();
                }
                remaining = notFull.awaitNanos(remaining);
            }
            return Optional.of(insert(text, source, priority));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts a new command without blocking.
     *
     * @throws QueueFullException if the queue is at capacity
     */
    public Command tryEnqueue(String text, CommandSource source, int priority) {
        validate(text, source);
        lock.lock();
        try {
            if (!closed && heap.size() >= capacity) {
                throw new QueueFullException(capacity);
            }
            return insert(text, source, priority);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the highest-priority, earliest-sequenced command,
     * blocking until one is available.
     */
    public Command dequeueBlocking() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && heap.isEmpty()) {
                notEmpty.await();
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    /**
     * As {@link #dequeueBlocking()}, but also returns empty when
     * {@link #wakeConsumer()} has been called since the last return.
     * A pending command is always preferred over a pending wake-up.
     */
    public Optional<Command> dequeueOrWake() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && heap.isEmpty() && !wakeRequested) {
                notEmpty.await();
            }
            if (!closed && heap.isEmpty()) {
                wakeRequested = false;
                return Optional.empty();
            }
            wakeRequested = false;
            return Optional.of(take());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the head command without blocking, but only if it matches.
     */
    public Optional<Command> pollIf(Predicate<Command> condition) {
        Objects.requireNonNull(condition, "condition");
        lock.lock();
        try {
            Command head = heap.peek();
            if (closed || head == null || !condition.test(head)) {
                return Optional.empty();
            }
            return Optional.of(take());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Interrupts a consumer blocked in {@link #dequeueOrWake()} without
     * delivering a command. The request is remembered if no consumer is
     * currently waiting.
     */
    public void wakeConsumer() {
        lock.lock();
        try {
            wakeRequested = true;
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every pending command whose priority is strictly below
     * {@code priority}.
     *
     * @return the discarded commands in service order
     */
    public List<Command> discardBelow(int priority) {
        lock.lock();
        try {
            List<Command> discarded = new ArrayList<>();
            Iterator<Command> it = heap.iterator();
            while (it.hasNext()) {
                Command c = it.next();
                if (c.priority() < priority) {
                    discarded.add(c);
                    it.remove();
                }
            }
            if (!discarded.isEmpty()) {
                notFull.signalAll();
            }
            discarded.sort(null);
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the queue. Idempotent.
     *
     * @return the commands that were still pending, in service order
     */
    public List<Command> close() {
        lock.lock();
        try {
            List<Command> pending = new ArrayList<>(heap.size());
            while (!heap.isEmpty()) {
                pending.add(heap.poll());
            }
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
            return pending;
        } finally {
            lock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Internals (lock held)
    // -------------------------------------------------------------------------

    private Command insert(String text, CommandSource source, int priority) {
        if (closed) {
            throw new QueueClosedException("Command queue is closed");
        }
        Command command = new Command(text, source, priority, nextSequence++);
        heap.add(command);
        notEmpty.signal();
        return command;
    }

    private Command take() {
        if (closed) {
            throw new QueueClosedException("Command queue is closed");
        }
        Command command = heap.poll();
        notFull.signal();
        return command;
    }

    private static void validate(String text, CommandSource source) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(source, "source");
    }
}
