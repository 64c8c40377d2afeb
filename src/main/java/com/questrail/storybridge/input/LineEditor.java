package com.questrail.storybridge.input;

import com.questrail.storybridge.api.Command;
import com.questrail.storybridge.api.CommandSource;
import com.questrail.storybridge.api.ControlDirective;

import java.util.Objects;
import java.util.Optional;

/**
 * LineEditor
 * -----------------------------------------------------------------------------
 * Keyboard producer: an editable input buffer with submit, history
 * navigation, cancel and undo.
 *
 * <p>Intended to be driven by a single UI thread; it is not thread-safe.
 * Submission goes through the shared {@link CommandIntake}, so with the
 * blocking overflow policy a submit may block the UI thread while the
 * command queue is full.</p>
 */
public final class LineEditor
{
    public static final int DEFAULT_HISTORY_SIZE = 500;

    private final CommandIntake intake;
    private final CommandHistory history;
    private String buffer = "";

    public LineEditor(CommandIntake intake) {
        this(intake, new CommandHistory(DEFAULT_HISTORY_SIZE));
    }

    public LineEditor(CommandIntake intake, CommandHistory history) {
        this.intake = Objects.requireNonNull(intake, "intake");
        this.history = Objects.requireNonNull(history, "history");
    }

    public String text() {
        return buffer;
    }

    public void setText(String text) {
        this.buffer = Objects.requireNonNull(text, "text");
    }

    /**
     * Submits the buffer as a keyboard command and clears it. A blank buffer
     * is cleared without submitting anything. Only lines that pass
     * {@link InputValidator} are recorded in the history.
     */
    public Optional<Command> submit() throws InterruptedException {
        String line = buffer.strip();
        buffer = "";
        if (line.isEmpty()) {
            return Optional.empty();
        }
        Optional<Command> submitted = intake.submit(line, CommandSource.KEYBOARD);
        if (InputValidator.rejectionReason(line).isEmpty()) {
            history.add(line);
        }
        return submitted;
    }

    public String historyPrevious() {
        buffer = history.previous();
        return buffer;
    }

    public String historyNext() {
        buffer = history.next();
        return buffer;
    }

    /**
     * Abandons the current edit and every queued line that has not reached
     * the engine yet.
     */
    public Optional<Command> cancel() throws InterruptedException {
        buffer = "";
        return intake.submit(ControlDirective.CANCEL);
    }

    public Optional<Command> undo() throws InterruptedException {
        return intake.submit(ControlDirective.UNDO);
    }

    public CommandHistory history() {
        return history;
    }
}
