package com.questrail.storybridge.internal.exec;

import com.questrail.storybridge.api.IntrospectionFailureException;
import com.questrail.storybridge.api.WorkerStoppedException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IntrospectionBridgeTest {

    private final AtomicInteger wakes = new AtomicInteger();
    private final IntrospectionBridge<int[]> bridge = new IntrospectionBridge<>(wakes::incrementAndGet);

    @Test
    void submittedQueryRunsAgainstStateWhenDrained() throws Exception {
        int[] state = {42};

        CompletableFuture<Integer> result = bridge.submit(s -> s[0]);

        assertFalse(result.isDone());
        assertEquals(1, bridge.pending());
        assertEquals(1, wakes.get());

        assertEquals(1, bridge.drain(state));
        assertEquals(42, result.get(1, TimeUnit.SECONDS));
        assertEquals(0, bridge.pending());
    }

    @Test
    void drainServicesTasksSubmittedDuringDrain() throws Exception {
        int[] state = {7};
        CompletableFuture<CompletableFuture<Integer>> nested = new CompletableFuture<>();

        bridge.submit(s -> {
            nested.complete(bridge.submit(inner -> inner[0] * 2));
            return null;
        });

        assertEquals(2, bridge.drain(state));
        assertEquals(14, nested.get().get(1, TimeUnit.SECONDS));
    }

    @Test
    void queryFailureIsDeliveredToCaller() throws Exception {
        CompletableFuture<Integer> result = bridge.submit(s -> 1 / s[0]);

        assertEquals(1, bridge.drain(new int[]{0}));

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(1, TimeUnit.SECONDS));
        assertInstanceOf(ArithmeticException.class, e.getCause());
    }

    @Test
    void callRethrowsUncheckedExceptionsUnchanged() throws Exception {
        Thread worker = drainOnce(new int[]{0});

        assertThrows(ArithmeticException.class, () -> bridge.call(s -> 1 / s[0]));
        worker.join(1000);
    }

    @Test
    void callWrapsCheckedExceptions() throws Exception {
        Thread worker = drainOnce(new int[]{0});

        IntrospectionFailureException e = assertThrows(IntrospectionFailureException.class,
            () -> bridge.call(s -> {
                throw new IOException("disk");
            }));
        assertInstanceOf(IOException.class, e.getCause());
        worker.join(1000);
    }

    @Test
    void closeFailsPendingAndFutureTasks() {
        CompletableFuture<Integer> pending = bridge.submit(s -> s[0]);

        assertEquals(1, bridge.close("engine halted"));
        assertTrue(bridge.isClosed());

        ExecutionException first = assertThrows(ExecutionException.class, pending::get);
        assertInstanceOf(WorkerStoppedException.class, first.getCause());

        CompletableFuture<Integer> late = bridge.submit(s -> s[0]);
        assertTrue(late.isCompletedExceptionally());
        assertThrows(WorkerStoppedException.class, () -> bridge.call(s -> s[0]));
        assertEquals(0, bridge.drain(new int[]{1}));
    }

    /**
     * Starts a thread standing in for the worker: it waits for the first
     * task and then drains against {@code state}.
     */
    private Thread drainOnce(int[] state) {
        Thread worker = new Thread(() -> {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (bridge.pending() == 0 && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            bridge.drain(state);
        });
        worker.start();
        return worker;
    }
}
