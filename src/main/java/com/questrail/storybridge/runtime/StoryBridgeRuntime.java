package com.questrail.storybridge.runtime;

import com.questrail.storybridge.api.Command;
import com.questrail.storybridge.api.CommandSource;
import com.questrail.storybridge.api.ControlDirective;
import com.questrail.storybridge.api.EngineQuery;
import com.questrail.storybridge.api.StoryEngine;
import com.questrail.storybridge.config.BridgeConfig;
import com.questrail.storybridge.core.OutputChannel;
import com.questrail.storybridge.core.PriorityCommandQueue;
import com.questrail.storybridge.input.CommandIntake;
import com.questrail.storybridge.input.LineEditor;
import com.questrail.storybridge.input.SpeechInput;
import com.questrail.storybridge.internal.exec.EngineWorker;
import com.questrail.storybridge.internal.exec.IntrospectionBridge;
import com.questrail.storybridge.internal.exec.WorkerState;
import com.questrail.storybridge.internal.time.MonotonicClock;
import com.questrail.storybridge.internal.time.SystemMonotonicClock;
import com.questrail.storybridge.internal.time.SystemWallClock;
import com.questrail.storybridge.internal.time.WallClock;
import com.questrail.storybridge.observability.BridgeObservabilitySink;
import com.questrail.storybridge.observability.NullObservabilitySink;
import com.questrail.storybridge.output.TranscriptListener;
import com.questrail.storybridge.output.TranscriptPump;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;

/**
 * StoryBridgeRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one story session.
 *
 * <h2>Topology</h2>
 * <pre>
 *   LineEditor / SpeechInput / submit(...)
 *        → CommandIntake (gate, validation, priority, overflow)
 *            → PriorityCommandQueue
 *                → EngineWorker ⇄ IntrospectionBridge ← query(...)
 *                    → OutputChannel
 *                        → TranscriptPump → TranscriptListener   (optional)
 * </pre>
 *
 * <p>Consumers either register a {@link TranscriptListener} on the builder or
 * read {@link #output()} themselves.</p>
 *
 * @param <S> engine state type; never exposed outside the worker
 */
public final class StoryBridgeRuntime<S> {
    private final PriorityCommandQueue commands;
    private final OutputChannel output;
    private final IntrospectionBridge<S> bridge;
    private final EngineWorker<S> worker;
    private final CommandIntake intake;
    private final LifecycleController lifecycle;
    private final LineEditor lineEditor;
    private final SpeechInput speechInput;
    private final TranscriptPump pump;

    private StoryBridgeRuntime(PriorityCommandQueue commands,
                               OutputChannel output,
                               IntrospectionBridge<S> bridge,
                               EngineWorker<S> worker,
                               CommandIntake intake,
                               LifecycleController lifecycle,
                               LineEditor lineEditor,
                               SpeechInput speechInput,
                               TranscriptPump pump) {
        this.commands = commands;
        this.output = output;
        this.bridge = bridge;
        this.worker = worker;
        this.intake = intake;
        this.lifecycle = lifecycle;
        this.lineEditor = lineEditor;
        this.speechInput = speechInput;
        this.pump = pump;
    }

    /**
     * Starts the transcript pump (if any) and the engine worker, returning
     * once producers may submit input.
     */
    public void start() throws InterruptedException {
        if (pump != null) {
            pump.start();
        }
        lifecycle.start();
    }

    /**
     * Shuts the session down. See {@link LifecycleController#shutdown()}.
     */
    public ShutdownOutcome shutdown() throws InterruptedException {
        ShutdownOutcome outcome = lifecycle.shutdown();
        if (pump != null && outcome == ShutdownOutcome.UNRESPONSIVE) {
            pump.stop();
        }
        return outcome;
    }

    public Optional<Command> submit(String text, CommandSource source) throws InterruptedException {
        return intake.submit(text, source);
    }

    public Optional<Command> submit(ControlDirective directive) throws InterruptedException {
        return intake.submit(directive);
    }

    /**
     * Runs a read-only query against engine state on the worker thread.
     */
    public <T> T query(EngineQuery<S, T> query) throws InterruptedException {
        return bridge.call(query);
    }

    public <T> CompletableFuture<T> queryAsync(EngineQuery<S, T> query) {
        return bridge.submit(query);
    }

    public OutputChannel output() {
        return output;
    }

    public LineEditor lineEditor() {
        return lineEditor;
    }

    public SpeechInput speechInput() {
        return speechInput;
    }

    public WorkerState workerState() {
        return worker.state();
    }

    public int pendingCommands() {
        return commands.size();
    }

    public static <S> Builder<S> builder(StoryEngine<S> engine) {
        return new Builder<>(engine);
    }

    public static final class Builder<S> {
        private final StoryEngine<S> engine;
        private BridgeConfig config = BridgeConfig.defaults();
        private BridgeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private TranscriptListener transcriptListener;
        private ThreadFactory workerThreadFactory = new DefaultThreadFactory("story-engine", true);
        private ThreadFactory pumpThreadFactory = new DefaultThreadFactory("story-transcript", true);
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        private Builder(StoryEngine<S> engine) {
            this.engine = Objects.requireNonNull(engine, "engine");
        }

        public Builder<S> withConfig(BridgeConfig config) {
            this.config = config;
            return this;
        }

        public Builder<S> withObservabilitySink(BridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder<S> withTranscriptListener(TranscriptListener listener) {
            this.transcriptListener = listener;
            return this;
        }

        public Builder<S> withWorkerThreadFactory(ThreadFactory factory) {
            this.workerThreadFactory = factory;
            return this;
        }

        public Builder<S> withPumpThreadFactory(ThreadFactory factory) {
            this.pumpThreadFactory = factory;
            return this;
        }

        public Builder<S> withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder<S> withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public StoryBridgeRuntime<S> build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(workerThreadFactory, "workerThreadFactory");
            Objects.requireNonNull(pumpThreadFactory, "pumpThreadFactory");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            BridgeObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Channels
            PriorityCommandQueue commands = new PriorityCommandQueue(config.commandCapacity());
            OutputChannel output = new OutputChannel(config.outputCapacity());

            // 2. Introspection wakes the worker out of its input wait
            IntrospectionBridge<S> bridge = new IntrospectionBridge<>(commands::wakeConsumer);

            // 3. Worker
            EngineWorker<S> worker = new EngineWorker<>(
                engine,
                commands,
                output,
                bridge,
                workerThreadFactory,
                wallClock,
                sink
            );

            // 4. Producer side
            CommandIntake intake = new CommandIntake(commands, config, wallClock, sink);
            LineEditor lineEditor = new LineEditor(intake);
            SpeechInput speechInput = new SpeechInput(intake, config.minimumSpeechConfidence());

            // 5. Lifecycle
            LifecycleController lifecycle = new LifecycleController(
                worker,
                commands,
                intake,
                config,
                clock,
                wallClock,
                sink
            );

            // 6. Optional consumer
            TranscriptPump pump = transcriptListener == null
                ? null
                : new TranscriptPump(output, transcriptListener, pumpThreadFactory, wallClock, sink);

            return new StoryBridgeRuntime<>(
                commands, output, bridge, worker, intake, lifecycle, lineEditor, speechInput, pump);
        }
    }
}
