package com.questrail.storybridge.core;

import com.questrail.storybridge.api.OutputChunk;
import com.questrail.storybridge.api.QueueClosedException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * OutputChannel
 * =============================================================================
 * Bounded FIFO of {@link OutputChunk}s from the engine worker to the display.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>No chunk is ever dropped: {@link #write(OutputChunk)} blocks while the
 *       channel is full.</li>
 *   <li>Chunks are read in exactly the order they were written.</li>
 *   <li>{@link OutputChunk#END_OF_STREAM} is returned only after every chunk
 *       written before {@link #close()} has been read, and is then returned to
 *       every subsequent read.</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * Written by the engine worker; read by one or more consumers. Each real chunk
 * is delivered to exactly one reader. The end-of-stream marker is not
 * consumed by reading it.
 */
public final class OutputChannel {

    private final int capacity;
    private final ArrayDeque<OutputChunk> chunks;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private boolean closed;

    public OutputChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.chunks = new ArrayDeque<>(Math.min(capacity, 64));
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        lock.lock();
        try {
            return chunks.size();
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
     * Appends a chunk, blocking while the channel is full.
     *
     * @throws QueueClosedException if the channel is or becomes closed
     */
    public void write(OutputChunk chunk) throws InterruptedException {
        Objects.requireNonNull(chunk, "chunk");
        if (chunk.isEndOfStream()) {
            throw new IllegalArgumentException("END_OF_STREAM is written by close()");
        }
        lock.lockInterruptibly();
        try {
            while (!closed && chunks.size() >= capacity) {
                notFull.await();
            }
            if (closed) {
                throw new QueueClosedException("Output channel is closed");
            }
            chunks.addLast(chunk);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the end of the stream. Idempotent and never blocks.
     *
     * @return {@code true} if this call closed the channel
     */
    public boolean close() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a chunk or the end of the stream is available.
     */
    public OutputChunk readBlocking() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && chunks.isEmpty()) {
                notEmpty.await();
            }
            return next();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits at most {@code timeout} for a chunk or the end of the stream.
     *
     * @return the chunk, or empty if nothing arrived in time
     */
    public Optional<OutputChunk> readBlocking(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (!closed && chunks.isEmpty()) {
                if (remaining <= 0L) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return Optional.of(next());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Non-blocking read for consumers that must never wait, such as a UI
     * thread polling on a timer.
     */
    public Optional<OutputChunk> poll() {
        lock.lock();
        try {
            if (!closed && chunks.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(next());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands every chunk to {@code consumer} until the end of the stream.
     * The end-of-stream marker itself is not passed on.
     *
     * @return the number of chunks delivered
     */
    public int forEachUntilClosed(Consumer<OutputChunk> consumer) throws InterruptedException {
        Objects.requireNonNull(consumer, "consumer");
        int delivered = 0;
        for (OutputChunk chunk = readBlocking(); !chunk.isEndOfStream(); chunk = readBlocking()) {
            consumer.accept(chunk);
            delivered++;
        }
        return delivered;
    }

    private OutputChunk next() {
        OutputChunk chunk = chunks.pollFirst();
        if (chunk == null) {
            return OutputChunk.END_OF_STREAM;
        }
        notFull.signal();
        return chunk;
    }
}
