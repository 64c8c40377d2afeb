package com.questrail.storybridge.api;

import java.util.Objects;

/**
 * StepResult
 * -----------------------------------------------------------------------------
 * Outcome of advancing a {@link StoryEngine} by one unit of execution.
 *
 * <ul>
 *   <li>{@link Kind#CONTINUE}: the step completed; {@code output} may hold text
 *       produced along the way.</li>
 *   <li>{@link Kind#NEEDS_INPUT}: the engine cannot advance until a line is fed
 *       to it; {@code output} may hold the prompt.</li>
 *   <li>{@link Kind#HALTED}: the story ended; {@code output} may hold the final
 *       text.</li>
 * </ul>
 */
public record StepResult(Kind kind, String output)
{
    public enum Kind {
        CONTINUE,
        NEEDS_INPUT,
        HALTED
    }

    private static final StepResult PROCEED = new StepResult(Kind.CONTINUE, "");
    private static final StepResult AWAIT_INPUT = new StepResult(Kind.NEEDS_INPUT, "");
    private static final StepResult HALT = new StepResult(Kind.HALTED, "");

    public StepResult {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(output, "output");
    }

    public static StepResult proceed() {
        return PROCEED;
    }

    public static StepResult output(String text) {
        return new StepResult(Kind.CONTINUE, text);
    }

    public static StepResult needsInput() {
        return AWAIT_INPUT;
    }

    public static StepResult needsInput(String prompt) {
        return new StepResult(Kind.NEEDS_INPUT, prompt);
    }

    public static StepResult halted() {
        return HALT;
    }

    public static StepResult halted(String finalText) {
        return new StepResult(Kind.HALTED, finalText);
    }

    public boolean hasOutput() {
        return !output.isEmpty();
    }
}
