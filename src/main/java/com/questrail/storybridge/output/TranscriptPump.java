package com.questrail.storybridge.output;

import com.questrail.storybridge.api.OutputChunk;
import com.questrail.storybridge.core.OutputChannel;
import com.questrail.storybridge.internal.time.WallClock;
import com.questrail.storybridge.observability.BridgeErrorEvent;
import com.questrail.storybridge.observability.BridgeObservabilitySink;
import com.questrail.storybridge.observability.NullObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * TranscriptPump
 * =============================================================================
 * Consumer thread that drains an {@link OutputChannel} into a
 * {@link TranscriptListener} until the end of the stream.
 *
 * <p>A listener that throws does not stop the pump; the failure is reported to
 * the observability sink and the next chunk is delivered.</p>
 */
public final class TranscriptPump {

    private final OutputChannel output;
    private final TranscriptListener listener;
    private final ThreadFactory threadFactory;
    private final WallClock wallClock;
    private final BridgeObservabilitySink observabilitySink;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile Thread thread;

    public TranscriptPump(OutputChannel output,
                          TranscriptListener listener,
                          ThreadFactory threadFactory,
                          WallClock wallClock,
                          BridgeObservabilitySink observabilitySink) {
        this.output = Objects.requireNonNull(output, "output");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public void start() {
        if (started.compareAndSet(false, true)) {
            thread = threadFactory.newThread(this::run);
            thread.start();
        }
    }

    /**
     * Stops pumping without waiting for the end of the stream.
     */
    public void stop() {
        Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
    }

    /**
     * Waits for the pump to deliver the end of the stream (or be stopped).
     */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void run() {
        try {
            OutputChunk chunk;
            do {
                chunk = output.readBlocking();
                dispatch(chunk);
            } while (!chunk.isEndOfStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            finished.countDown();
        }
    }

    private void dispatch(OutputChunk chunk) {
        try {
            switch (chunk.kind()) {
                case TEXT -> listener.onText(chunk.payload());
                case ERROR -> listener.onError(chunk.payload());
                case END_OF_STREAM -> listener.onEndOfStream();
            }
        } catch (RuntimeException e) {
            observabilitySink.onError(new BridgeErrorEvent(
                    wallClock.now(), "Transcript listener failed on " + chunk.kind() + " chunk", e));
        }
    }
}
