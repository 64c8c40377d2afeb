package com.questrail.storybridge.internal.exec;

import com.questrail.storybridge.api.Command;
import com.questrail.storybridge.api.ControlDirective;
import com.questrail.storybridge.api.OutputChunk;
import com.questrail.storybridge.api.QueueClosedException;
import com.questrail.storybridge.api.StepResult;
import com.questrail.storybridge.api.StoryEngine;
import com.questrail.storybridge.core.OutputChannel;
import com.questrail.storybridge.core.PriorityCommandQueue;
import com.questrail.storybridge.internal.time.WallClock;
import com.questrail.storybridge.observability.BridgeErrorEvent;
import com.questrail.storybridge.observability.BridgeObservabilitySink;
import com.questrail.storybridge.observability.InputDiscardedEvent;
import com.questrail.storybridge.observability.NullObservabilitySink;
import com.questrail.storybridge.observability.WorkerStateTransitionEvent;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * EngineWorker
 * =============================================================================
 * The single thread that owns engine state and runs the story.
 *
 * <h2>Loop</h2>
 * While {@link WorkerState#RUNNING}, each iteration:
 * <ol>
 *   <li>drains the {@link IntrospectionBridge} completely, one task at a time;</li>
 *   <li>if the engine asked for input, waits on the command queue, servicing
 *       introspection tasks whenever it is woken without a command;</li>
 *   <li>otherwise advances the engine by one step and writes any output.</li>
 * </ol>
 * Steps 1 and 3 never overlap, so a query never observes a partial step.
 *
 * <h2>Ownership</h2>
 * The engine state exists only as a local variable of the worker thread. It is
 * passed to {@link StoryEngine} calls and to introspection queries on this
 * thread and is never stored in a field.
 *
 * <h2>Stopping</h2>
 * The worker stops when the engine halts, when a {@link ControlDirective#QUIT}
 * system command is dequeued, when {@code open} or {@code step} fails, or when
 * {@link #requestStop()} is called. While stopping it closes the command queue
 * (nothing queued is delivered afterwards), fails pending introspection tasks,
 * closes the engine, and finally closes the output channel.
 *
 * @param <S> engine state type
 */
public final class EngineWorker<S> {

    private final StoryEngine<S> engine;
    private final PriorityCommandQueue commands;
    private final OutputChannel output;
    private final IntrospectionBridge<S> bridge;
    private final ThreadFactory threadFactory;
    private final WallClock wallClock;
    private final BridgeObservabilitySink observabilitySink;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean reachedRunning = new AtomicBoolean(false);
    private final CountDownLatch ready = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile WorkerState state = WorkerState.STARTING;
    private volatile Thread thread;

    // Guards interruptible: once stop() begins, requestStop() no longer interrupts.
    private final Object interruptLock = new Object();
    private boolean interruptible = true;

    public EngineWorker(StoryEngine<S> engine,
                        PriorityCommandQueue commands,
                        OutputChannel output,
                        IntrospectionBridge<S> bridge,
                        ThreadFactory threadFactory,
                        WallClock wallClock,
                        BridgeObservabilitySink observabilitySink)
    {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.output = Objects.requireNonNull(output, "output");
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts the worker thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (started.compareAndSet(false, true)) {
            thread = threadFactory.newThread(this::run);
            thread.start();
        }
    }

    /**
     * Asks the worker to stop as soon as possible, interrupting it if it is
     * blocked waiting for input or for space in the output channel.
     */
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            synchronized (interruptLock) {
                Thread t = thread;
                if (t != null && interruptible) {
                    t.interrupt();
                }
            }
        }
    }

    /**
     * Stops a worker whose thread was never started, on the calling thread.
     * Afterwards the worker is {@link WorkerState#STOPPED}, both queues and
     * the introspection bridge are closed, and {@link #start()} has no effect.
     *
     * @return {@code false} if the worker had already been started
     */
    public boolean abandonIfNotStarted(String reason) {
        Objects.requireNonNull(reason, "reason");
        if (!started.compareAndSet(false, true)) {
            return false;
        }
        stopRequested.set(true);
        ready.countDown();
        stop(null, reason);
        return true;
    }

    public boolean isStarted() {
        return started.get();
    }

    public WorkerState state() {
        return state;
    }

    /**
     * Waits until the worker is running or has given up starting.
     *
     * @return {@code true} if the worker reached {@link WorkerState#RUNNING} in
     *         time, even if it has stopped again since
     */
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        return ready.await(timeout.toNanos(), TimeUnit.NANOSECONDS) && reachedRunning.get();
    }

    /**
     * Waits until the worker reaches {@link WorkerState#STOPPED}.
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    // -------------------------------------------------------------------------
    // Worker thread
    // -------------------------------------------------------------------------

    private void run() {
        S engineState = null;
        String reason = "stop requested";
        VirtualMachineError vmError = null;
        try {
            engineState = engine.open();
            if (!stopRequested.get()) {
                transition(WorkerState.RUNNING, "engine opened");
                reachedRunning.set(true);
                ready.countDown();
                reason = loop(engineState);
            }
        } catch (InterruptedException e) {
            reason = stopRequested.get() ? "stop requested" : "interrupted";
        } catch (QueueClosedException e) {
            reason = stopRequested.get() ? "stop requested" : e.getMessage();
        } catch (Throwable t) {
            reason = "fatal engine error";
            reportFatal(t);
            if (t instanceof VirtualMachineError vme) {
                vmError = vme;
            }
        } finally {
            ready.countDown();
            stop(engineState, reason);
        }
        // Rethrown after cleanup for the thread's uncaught exception handler.
        if (vmError != null) {
            throw vmError;
        }
    }

    /**
     * @return why the loop ended
     */
    private String loop(S engineState) throws Exception {
        boolean awaitingInput = false;
        while (!stopRequested.get()) {
            bridge.drain(engineState);

            if (awaitingInput) {
                Optional<Command> next = commands.dequeueOrWake();
                if (next.isEmpty()) {
                    continue;
                }
                Command command = next.get();
                Optional<ControlDirective> directive = command.directive();
                if (directive.isPresent()) {
                    if (directive.get() == ControlDirective.QUIT) {
                        return "quit directive";
                    }
                    awaitingInput = !applyDirective(engineState, command, directive.get());
                } else {
                    awaitingInput = !feed(engineState, command, command.text());
                }
                continue;
            }

            Optional<Command> control = commands.pollIf(EngineWorker::isOutOfBandDirective);
            if (control.isPresent()) {
                if (control.get().directive().orElseThrow() == ControlDirective.QUIT) {
                    return "quit directive";
                }
                discardBelow(control.get());
                continue;
            }

            StepResult result = engine.step(engineState);
            if (result.hasOutput()) {
                output.write(OutputChunk.text(result.output()));
            }
            switch (result.kind()) {
                case NEEDS_INPUT -> awaitingInput = true;
                case HALTED -> {
                    return "engine halted";
                }
                case CONTINUE -> { }
            }
        }
        return "stop requested";
    }

    /**
     * @return {@code true} if the engine accepted a line and no longer waits for input
     */
    private boolean applyDirective(S engineState, Command command, ControlDirective directive)
            throws InterruptedException {
        if (directive == ControlDirective.CANCEL) {
            discardBelow(command);
            return false;
        }
        Optional<String> line = directive.engineLine();
        return line.isPresent() && feed(engineState, command, line.get());
    }

    private boolean feed(S engineState, Command command, String line) throws InterruptedException {
        try {
            engine.feedLine(engineState, line);
            return true;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            observabilitySink.onError(new BridgeErrorEvent(
                    wallClock.now(),
                    "Engine rejected " + command.source() + " input #" + command.sequence(),
                    e
            ));
            output.write(OutputChunk.error("[input rejected] " + describe(e)));
            return false;
        }
    }

    private void discardBelow(Command directive) {
        for (Command dropped : commands.discardBelow(directive.priority())) {
            observabilitySink.onInputDiscarded(new InputDiscardedEvent(
                    wallClock.now(), dropped.source(), dropped.text(), "cancelled by system directive"));
        }
    }

    private void reportFatal(Throwable e) {
        observabilitySink.onError(new BridgeErrorEvent(wallClock.now(), "Fatal engine error", e));
        try {
            output.write(OutputChunk.error("[fatal] " + describe(e)));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (QueueClosedException closed) {
            observabilitySink.onError(new BridgeErrorEvent(
                    wallClock.now(), "Fatal error could not be written to closed output", closed));
        }
    }

    private void stop(S engineState, String reason) {
        transition(WorkerState.STOPPING, reason);

        List<Command> abandoned = commands.close();
        for (Command command : abandoned) {
            observabilitySink.onInputDiscarded(new InputDiscardedEvent(
                    wallClock.now(), command.source(), command.text(), "engine worker stopping"));
        }
        bridge.close(reason);

        // A stop request may have interrupted a running step; close must not
        // inherit that interrupt.
        boolean interrupted;
        synchronized (interruptLock) {
            interruptible = false;
            interrupted = Thread.interrupted();
        }
        if (engineState != null) {
            try {
                engine.close(engineState);
            } catch (Exception e) {
                observabilitySink.onError(new BridgeErrorEvent(wallClock.now(), "Engine close failed", e));
            }
        }

        output.close();
        transition(WorkerState.STOPPED, reason);
        stopped.countDown();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void transition(WorkerState next, String reason) {
        WorkerState previous = state;
        state = next;
        observabilitySink.onStateTransition(new WorkerStateTransitionEvent(
                wallClock.now(), previous, next, reason));
    }

    private static boolean isOutOfBandDirective(Command command) {
        Optional<ControlDirective> directive = command.directive();
        return directive.isPresent()
                && (directive.get() == ControlDirective.QUIT || directive.get() == ControlDirective.CANCEL);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
