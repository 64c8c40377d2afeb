package com.questrail.storybridge.runtime;

import com.questrail.storybridge.api.Command;
import com.questrail.storybridge.api.CommandSource;
import com.questrail.storybridge.api.ControlDirective;
import com.questrail.storybridge.api.QueueClosedException;
import com.questrail.storybridge.config.BridgeConfig;
import com.questrail.storybridge.core.PriorityCommandQueue;
import com.questrail.storybridge.input.CommandIntake;
import com.questrail.storybridge.internal.exec.EngineWorker;
import com.questrail.storybridge.internal.exec.WorkerState;
import com.questrail.storybridge.internal.time.MonotonicClock;
import com.questrail.storybridge.internal.time.WallClock;
import com.questrail.storybridge.observability.BridgeObservabilitySink;
import com.questrail.storybridge.observability.LifecycleEvent;
import com.questrail.storybridge.observability.NullObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * LifecycleController
 * =============================================================================
 * Owns startup ordering and shutdown escalation for one engine worker.
 *
 * <h2>Startup</h2>
 * The worker thread is spawned and the controller waits, up to
 * {@link BridgeConfig#startupTimeout()}, for it to report readiness. Only then
 * is the {@link CommandIntake} opened to producers.
 *
 * <h2>Shutdown</h2>
 * A worker that was never started is stopped on the calling thread without
 * waiting. Otherwise:
 * <pre>
 *   close intake
 *     → enqueue SYSTEM :quit at the highest priority
 *       → wait for STOPPED (shutdownTimeout, shared with the enqueue)
 *         → timed out: requestStop() interrupts the worker
 *           → wait for STOPPED (forceStopTimeout)
 * </pre>
 * Timeouts exist only at this layer. Queue operations themselves never time
 * out.
 */
public final class LifecycleController {

    private final EngineWorker<?> worker;
    private final PriorityCommandQueue commands;
    private final CommandIntake intake;
    private final BridgeConfig config;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final BridgeObservabilitySink observabilitySink;

    public LifecycleController(EngineWorker<?> worker,
                               PriorityCommandQueue commands,
                               CommandIntake intake,
                               BridgeConfig config,
                               MonotonicClock clock,
                               WallClock wallClock,
                               BridgeObservabilitySink observabilitySink) {
        this.worker = Objects.requireNonNull(worker, "worker");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.intake = Objects.requireNonNull(intake, "intake");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts the worker and opens the intake once it is running.
     *
     * @throws IllegalStateException if the worker did not reach
     *         {@link WorkerState#RUNNING} within the startup timeout
     */
    public void start() throws InterruptedException {
        worker.start();
        if (!worker.awaitReady(config.startupTimeout())) {
            intake.close();
            worker.requestStop();
            throw new IllegalStateException("Engine worker failed to start (state " + worker.state() + ")");
        }
        intake.open();
        lifecycle(LifecycleEvent.Phase.STARTED, "engine worker running");
    }

    /**
     * Shuts the worker down, escalating to an interrupt if the quit directive
     * is not serviced in time.
     */
    public ShutdownOutcome shutdown() throws InterruptedException {
        intake.close();
        if (worker.abandonIfNotStarted("shutdown before start")) {
            lifecycle(LifecycleEvent.Phase.SHUTDOWN_COMPLETE, "worker was never started");
            return ShutdownOutcome.NEVER_STARTED;
        }
        WorkerState current = worker.state();
        if ((current == WorkerState.STOPPING || current == WorkerState.STOPPED)
                && worker.awaitStopped(config.shutdownTimeout())) {
            return ShutdownOutcome.ALREADY_STOPPED;
        }

        lifecycle(LifecycleEvent.Phase.SHUTDOWN_REQUESTED, "submitting " + ControlDirective.QUIT.token());
        long deadline = clock.nowNanos() + config.shutdownTimeout().toNanos();
        try {
            Optional<Command> quit = commands.enqueue(
                    ControlDirective.QUIT.token(),
                    CommandSource.SYSTEM,
                    config.priorityOf(CommandSource.SYSTEM),
                    config.shutdownTimeout());
            if (quit.isEmpty()) {
                lifecycle(LifecycleEvent.Phase.SHUTDOWN_REQUESTED, "command queue full, quit not queued");
            }
        } catch (QueueClosedException e) {
            lifecycle(LifecycleEvent.Phase.SHUTDOWN_REQUESTED, "worker already stopping");
        }

        Duration remaining = Duration.ofNanos(Math.max(0L, deadline - clock.nowNanos()));
        if (worker.awaitStopped(remaining)) {
            lifecycle(LifecycleEvent.Phase.SHUTDOWN_COMPLETE, "graceful");
            return ShutdownOutcome.GRACEFUL;
        }

        lifecycle(LifecycleEvent.Phase.FORCE_STOP_REQUESTED,
                "worker still " + worker.state() + " after " + config.shutdownTimeout());
        worker.requestStop();
        if (worker.awaitStopped(config.forceStopTimeout())) {
            lifecycle(LifecycleEvent.Phase.SHUTDOWN_COMPLETE, "forced");
            return ShutdownOutcome.FORCED;
        }

        lifecycle(LifecycleEvent.Phase.SHUTDOWN_COMPLETE,
                "worker unresponsive in state " + worker.state());
        return ShutdownOutcome.UNRESPONSIVE;
    }

    private void lifecycle(LifecycleEvent.Phase phase, String detail) {
        observabilitySink.onLifecycleEvent(new LifecycleEvent(wallClock.now(), phase, detail));
    }
}
