package com.questrail.storybridge.internal.exec;

import com.questrail.storybridge.api.EngineQuery;
import com.questrail.storybridge.api.IntrospectionFailureException;
import com.questrail.storybridge.api.WorkerStoppedException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * IntrospectionBridge
 * =============================================================================
 * Lets any thread run a read-only {@link EngineQuery} as if it were running on
 * the engine worker thread.
 *
 * <h2>How it works</h2>
 * A query is wrapped in a task and appended to a queue that only the
 * {@link EngineWorker} drains. The worker empties this queue before every unit
 * of engine execution and whenever it is woken while waiting for input, so a
 * query always sees the state between two complete steps. The engine state is
 * handed to the query as a parameter on the worker thread; callers never hold
 * a reference to it.
 *
 * <h2>Caller obligations</h2>
 * Queries run on the engine's only thread and stall both game progress and
 * output while they run. They must be short, non-blocking and must return
 * copies. No timeout is enforced here.
 *
 * <h2>Failure</h2>
 * An exception thrown by a query is delivered to its caller and never
 * reaches the worker. Once the worker stops, pending and new tasks fail with
 * {@link WorkerStoppedException}.
 */
public final class IntrospectionBridge<S> {

    private final Object lock = new Object();
    private final Queue<IntrospectionTask<S, ?>> tasks = new ArrayDeque<>();
    private final Runnable wakeWorker;

    private boolean closed;

    /**
     * @param wakeWorker invoked after each submission so that a worker blocked
     *                   waiting for input services the task promptly
     */
    public IntrospectionBridge(Runnable wakeWorker) {
        this.wakeWorker = Objects.requireNonNull(wakeWorker, "wakeWorker");
    }

    /**
     * Submits a query and returns a future for its result.
     */
    public <T> CompletableFuture<T> submit(EngineQuery<S, T> query) {
        IntrospectionTask<S, T> task = new IntrospectionTask<>(query);
        synchronized (lock) {
            if (closed) {
                task.fail(new WorkerStoppedException("Engine worker has stopped"));
                return task.result();
            }
            tasks.add(task);
        }
        wakeWorker.run();
        return task.result();
    }

    /**
     * Runs a query on the worker thread and waits for its result.
     *
     * <p>Unchecked exceptions and errors thrown by the query are re-thrown
     * unchanged. Checked exceptions arrive wrapped in
     * {@link IntrospectionFailureException}.</p>
     *
     * @throws WorkerStoppedException if the worker stopped before servicing it
     * @throws InterruptedException if the caller is interrupted while waiting
     */
    public <T> T call(EngineQuery<S, T> query) throws InterruptedException {
        CompletableFuture<T> result = submit(query);
        try {
            return result.get();
        } catch (ExecutionException e) {
            throw propagate(e.getCause());
        }
    }

    public int pending() {
        synchronized (lock) {
            return tasks.size();
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    // -------------------------------------------------------------------------
    // Worker-side operations
    // -------------------------------------------------------------------------

    /**
     * Services tasks one at a time until the queue is empty, including tasks
     * submitted while draining. Must only be called on the worker thread.
     *
     * @return the number of tasks serviced
     */
    int drain(S state) {
        int serviced = 0;
        for (IntrospectionTask<S, ?> task = next(); task != null; task = next()) {
            task.run(state);
            serviced++;
        }
        return serviced;
    }

    /**
     * Rejects all current and future tasks.
     *
     * @return the number of pending tasks that were failed
     */
    int close(String reason) {
        List<IntrospectionTask<S, ?>> abandoned;
        synchronized (lock) {
            closed = true;
            abandoned = new ArrayList<>(tasks);
            tasks.clear();
        }
        for (IntrospectionTask<S, ?> task : abandoned) {
            task.fail(new WorkerStoppedException("Engine worker stopped: " + reason));
        }
        return abandoned.size();
    }

    private IntrospectionTask<S, ?> next() {
        synchronized (lock) {
            return tasks.poll();
        }
    }

    private static RuntimeException propagate(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IntrospectionFailureException(cause);
    }
}
