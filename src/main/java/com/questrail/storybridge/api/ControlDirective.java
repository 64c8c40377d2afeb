package com.questrail.storybridge.api;

import java.util.Objects;
import java.util.Optional;

/**
 * ControlDirective
 * -----------------------------------------------------------------------------
 * Control tokens carried by {@link CommandSource#SYSTEM} commands.
 *
 * <p>A directive is an ordinary {@link Command}; the token is its text. The
 * engine worker recognises the token only when the command came from the
 * system source, so a player typing {@code :quit} at the keyboard just sends
 * that line to the story.</p>
 */
public enum ControlDirective
{
    /** Stop the engine worker. Commands still queued are never delivered. */
    QUIT(":quit", null),

    /** Ask the story to take back the last turn. */
    UNDO(":undo", "undo"),

    /** Discard every pending command of lower priority than the directive. */
    CANCEL(":cancel", null);

    private final String token;
    private final String engineLine;

    ControlDirective(String token, String engineLine) {
        this.token = token;
        this.engineLine = engineLine;
    }

    public String token() {
        return token;
    }

    /**
     * Line delivered to the engine when this directive is serviced, or empty
     * when the worker handles the directive itself.
     */
    public Optional<String> engineLine() {
        return Optional.ofNullable(engineLine);
    }

    public static Optional<ControlDirective> fromToken(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        for (ControlDirective d : values()) {
            if (d.token.equalsIgnoreCase(trimmed)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
