package com.questrail.storybridge.internal.exec;

import com.questrail.storybridge.api.EngineQuery;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One pending read of engine state, paired with its single-assignment result.
 */
final class IntrospectionTask<S, T> {

    private final EngineQuery<S, T> query;
    private final CompletableFuture<T> result = new CompletableFuture<>();

    IntrospectionTask(EngineQuery<S, T> query) {
        this.query = Objects.requireNonNull(query, "query");
    }

    CompletableFuture<T> result() {
        return result;
    }

    /**
     * Runs the query against the worker-owned state. Whatever the query
     * throws is delivered to the waiting caller, never to the worker.
     */
    void run(S state) {
        try {
            result.complete(query.read(state));
        } catch (Throwable t) {
            result.completeExceptionally(t);
        }
    }

    void fail(Throwable cause) {
        result.completeExceptionally(cause);
    }
}
