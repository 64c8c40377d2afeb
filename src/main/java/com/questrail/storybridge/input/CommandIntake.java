package com.questrail.storybridge.input;

import com.questrail.storybridge.api.Command;
import com.questrail.storybridge.api.CommandSource;
import com.questrail.storybridge.api.ControlDirective;
import com.questrail.storybridge.api.QueueClosedException;
import com.questrail.storybridge.api.QueueFullException;
import com.questrail.storybridge.config.BridgeConfig;
import com.questrail.storybridge.config.OverflowPolicy;
import com.questrail.storybridge.core.PriorityCommandQueue;
import com.questrail.storybridge.internal.time.WallClock;
import com.questrail.storybridge.observability.BridgeObservabilitySink;
import com.questrail.storybridge.observability.InputDiscardedEvent;
import com.questrail.storybridge.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CommandIntake
 * =============================================================================
 * The single entry point through which every producer submits input.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Gate: input is refused before the worker reports readiness
 *       ({@link IllegalStateException}) and after shutdown begins
 *       ({@link QueueClosedException}).</li>
 *   <li>Validation: malformed lines are discarded and reported, never
 *       enqueued.</li>
 *   <li>Priority: each source is stamped with its configured priority.</li>
 *   <li>Overflow: {@link OverflowPolicy#BLOCK} waits for space;
 *       {@link OverflowPolicy#DROP} discards and reports instead.</li>
 * </ul>
 *
 * <p>Thread-safe. Producers on any thread may share one instance.</p>
 */
public final class CommandIntake {

    enum Gate { PENDING, OPEN, CLOSED }

    private final PriorityCommandQueue commands;
    private final BridgeConfig config;
    private final WallClock wallClock;
    private final BridgeObservabilitySink observabilitySink;
    private final AtomicReference<Gate> gate = new AtomicReference<>(Gate.PENDING);

    public CommandIntake(PriorityCommandQueue commands,
                         BridgeConfig config,
                         WallClock wallClock,
                         BridgeObservabilitySink observabilitySink) {
        this.commands = Objects.requireNonNull(commands, "commands");
        this.config = Objects.requireNonNull(config, "config");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts accepting input. Has no effect once the intake is closed.
     */
    public void open() {
        gate.compareAndSet(Gate.PENDING, Gate.OPEN);
    }

    /**
     * Stops accepting input for good.
     */
    public void close() {
        gate.set(Gate.CLOSED);
    }

    public boolean isOpen() {
        return gate.get() == Gate.OPEN;
    }

    /**
     * Validates and enqueues one line from {@code source}.
     *
     * @return the enqueued command, or empty if the line was discarded
     * @throws IllegalStateException if the bridge has not started yet
     * @throws QueueClosedException if the bridge is shutting down
     * @throws InterruptedException if interrupted while blocked on a full queue
     */
    public Optional<Command> submit(String text, CommandSource source) throws InterruptedException {
        Objects.requireNonNull(source, "source");
        checkGate();

        Optional<String> rejection = InputValidator.rejectionReason(text);
        if (rejection.isPresent()) {
            discarded(source, text, rejection.get());
            return Optional.empty();
        }

        String line = InputValidator.normalize(text);
        int priority = config.priorityOf(source);
        if (config.overflowPolicy() == OverflowPolicy.BLOCK) {
            return Optional.of(commands.enqueue(line, source, priority));
        }
        try {
            return Optional.of(commands.tryEnqueue(line, source, priority));
        } catch (QueueFullException e) {
            discarded(source, line, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Submits a control directive from the system source.
     */
    public Optional<Command> submit(ControlDirective directive) throws InterruptedException {
        Objects.requireNonNull(directive, "directive");
        return submit(directive.token(), CommandSource.SYSTEM);
    }

    void discarded(CommandSource source, String text, String reason) {
        observabilitySink.onInputDiscarded(new InputDiscardedEvent(wallClock.now(), source, text, reason));
    }

    private void checkGate() {
        switch (gate.get()) {
            case PENDING -> throw new IllegalStateException("Bridge is not accepting input yet");
            case CLOSED -> throw new QueueClosedException("Bridge is shutting down");
            case OPEN -> { }
        }
    }
}
