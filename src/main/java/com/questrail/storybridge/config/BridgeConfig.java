package com.questrail.storybridge.config;

import com.questrail.storybridge.api.CommandSource;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * BridgeConfig
 * -----------------------------------------------------------------------------
 * Aggregated configuration for a story bridge runtime.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>commandCapacity</b>: bound of the priority command queue.</li>
 *   <li><b>outputCapacity</b>: bound of the output channel.</li>
 *   <li><b>overflowPolicy</b>: producer behavior when the command queue is
 *       full.</li>
 *   <li><b>priorities</b>: priority assigned to each {@link CommandSource}.
 *       {@link CommandSource#SYSTEM} must hold the strictly highest value.</li>
 *   <li><b>minimumSpeechConfidence</b>: speech transcripts below this
 *       recognizer confidence are discarded.</li>
 *   <li><b>startupTimeout</b>: how long startup waits for the worker to report
 *       readiness.</li>
 *   <li><b>shutdownTimeout</b>: how long graceful shutdown waits after
 *       submitting the quit directive.</li>
 *   <li><b>forceStopTimeout</b>: how long forced shutdown waits after
 *       interrupting the worker.</li>
 * </ul>
 */
public record BridgeConfig(
        int commandCapacity,
        int outputCapacity,
        OverflowPolicy overflowPolicy,
        Map<CommandSource, Integer> priorities,
        double minimumSpeechConfidence,
        Duration startupTimeout,
        Duration shutdownTimeout,
        Duration forceStopTimeout
) {
    public static final int DEFAULT_CAPACITY = 2048;

    public BridgeConfig {
        if (commandCapacity <= 0) {
            throw new IllegalArgumentException("commandCapacity must be positive");
        }
        if (outputCapacity <= 0) {
            throw new IllegalArgumentException("outputCapacity must be positive");
        }
        Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        Objects.requireNonNull(priorities, "priorities");
        Objects.requireNonNull(startupTimeout, "startupTimeout");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        Objects.requireNonNull(forceStopTimeout, "forceStopTimeout");

        EnumMap<CommandSource, Integer> resolved = new EnumMap<>(CommandSource.class);
        for (CommandSource source : CommandSource.values()) {
            resolved.put(source, priorities.getOrDefault(source, source.defaultPriority()));
        }
        int system = resolved.get(CommandSource.SYSTEM);
        for (CommandSource source : CommandSource.values()) {
            if (source != CommandSource.SYSTEM && resolved.get(source) >= system) {
                throw new IllegalArgumentException(
                        "SYSTEM priority must exceed " + source + " priority");
            }
        }
        priorities = Collections.unmodifiableMap(resolved);

        if (minimumSpeechConfidence < 0.0 || minimumSpeechConfidence > 1.0) {
            throw new IllegalArgumentException("minimumSpeechConfidence must be within [0, 1]");
        }
        if (startupTimeout.isNegative() || startupTimeout.isZero()) {
            throw new IllegalArgumentException("startupTimeout must be positive");
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative");
        }
        if (forceStopTimeout.isNegative()) {
            throw new IllegalArgumentException("forceStopTimeout must be non-negative");
        }
    }

    public int priorityOf(CommandSource source) {
        return priorities.get(Objects.requireNonNull(source, "source"));
    }

    /**
     * Default values: capacities 2048, {@link OverflowPolicy#BLOCK}, source
     * default priorities, no speech confidence floor, 5 second timeouts.
     */
    public static BridgeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int commandCapacity = DEFAULT_CAPACITY;
        private int outputCapacity = DEFAULT_CAPACITY;
        private OverflowPolicy overflowPolicy = OverflowPolicy.BLOCK;
        private final Map<CommandSource, Integer> priorities = new EnumMap<>(CommandSource.class);
        private double minimumSpeechConfidence = 0.0;
        private Duration startupTimeout = Duration.ofSeconds(5);
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private Duration forceStopTimeout = Duration.ofSeconds(5);

        public Builder withCommandCapacity(int capacity) {
            this.commandCapacity = capacity;
            return this;
        }

        public Builder withOutputCapacity(int capacity) {
            this.outputCapacity = capacity;
            return this;
        }

        public Builder withOverflowPolicy(OverflowPolicy policy) {
            this.overflowPolicy = policy;
            return this;
        }

        public Builder withPriority(CommandSource source, int priority) {
            this.priorities.put(Objects.requireNonNull(source, "source"), priority);
            return this;
        }

        public Builder withMinimumSpeechConfidence(double confidence) {
            this.minimumSpeechConfidence = confidence;
            return this;
        }

        public Builder withStartupTimeout(Duration timeout) {
            this.startupTimeout = timeout;
            return this;
        }

        public Builder withShutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        public Builder withForceStopTimeout(Duration timeout) {
            this.forceStopTimeout = timeout;
            return this;
        }

        public BridgeConfig build() {
            return new BridgeConfig(
                    commandCapacity,
                    outputCapacity,
                    overflowPolicy,
                    priorities,
                    minimumSpeechConfidence,
                    startupTimeout,
                    shutdownTimeout,
                    forceStopTimeout
            );
        }
    }
}
