package com.questrail.storybridge.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Command
 * -----------------------------------------------------------------------------
 * One submitted line of input together with its routing metadata.
 *
 * <h2>Ordering</h2>
 * The natural order is {@code (priority desc, sequence asc)}: a higher
 * priority is served first, and within one priority the earlier sequence
 * number wins. Sequence numbers are handed out by the owning
 * {@code PriorityCommandQueue} and are unique within it, so two distinct
 * commands from the same queue never compare equal.
 *
 * <p>Instances are immutable and safe to pass between threads.</p>
 */
public record Command(
        String text,
        CommandSource source,
        int priority,
        long sequence
) implements Comparable<Command>
{
    public Command {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(source, "source");
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
    }

    /**
     * Returns the control directive this command carries, if any.
     * Only {@link CommandSource#SYSTEM} commands can carry directives.
     */
    public Optional<ControlDirective> directive() {
        if (source != CommandSource.SYSTEM) {
            return Optional.empty();
        }
        return ControlDirective.fromToken(text);
    }

    @Override
    public int compareTo(Command other) {
        int byPriority = Integer.compare(other.priority, this.priority);
        if (byPriority != 0) {
            return byPriority;
        }
        return Long.compare(this.sequence, other.sequence);
    }
}
