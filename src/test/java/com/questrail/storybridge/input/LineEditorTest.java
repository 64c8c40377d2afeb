package com.questrail.storybridge.input;

import com.questrail.storybridge.api.Command;
import com.questrail.storybridge.api.CommandSource;
import com.questrail.storybridge.api.ControlDirective;
import com.questrail.storybridge.config.BridgeConfig;
import com.questrail.storybridge.core.PriorityCommandQueue;
import com.questrail.storybridge.internal.time.SystemWallClock;
import com.questrail.storybridge.observability.NullObservabilitySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LineEditorTest {

    private PriorityCommandQueue queue;
    private LineEditor editor;

    @BeforeEach
    void setUp() {
        queue = new PriorityCommandQueue(16);
        CommandIntake intake = new CommandIntake(
                queue, BridgeConfig.defaults(), SystemWallClock.INSTANCE, NullObservabilitySink.INSTANCE);
        intake.open();
        editor = new LineEditor(intake);
    }

    @Test
    void submitSendsKeyboardCommandAndClearsBuffer() throws InterruptedException {
        editor.setText("take lamp ");

        Command command = editor.submit().orElseThrow();

        assertEquals("take lamp", command.text());
        assertEquals(CommandSource.KEYBOARD, command.source());
        assertEquals("", editor.text());
        assertEquals(1, queue.size());
    }

    @Test
    void blankSubmitSendsNothing() throws InterruptedException {
        editor.setText("   ");

        assertEquals(Optional.empty(), editor.submit());
        assertEquals(0, queue.size());
        assertEquals(0, editor.history().size());
    }

    @Test
    void historyRecallsSubmittedLines() throws InterruptedException {
        editor.setText("north");
        editor.submit();
        editor.setText("open window");
        editor.submit();

        assertEquals("open window", editor.historyPrevious());
        assertEquals("north", editor.historyPrevious());
        assertEquals("north", editor.text());
        assertEquals("open window", editor.historyNext());
        assertEquals("", editor.historyNext());
    }

    @Test
    void rejectedLineIsNotRecordedInHistory() throws InterruptedException {
        editor.setText("north");
        editor.submit();
        editor.setText("go" + (char) 0x1B + "south");

        assertEquals(Optional.empty(), editor.submit());

        assertEquals(List.of("north"), editor.history().entries());
        assertEquals("north", editor.historyPrevious());
        assertEquals(1, queue.size());
    }

    @Test
    void cancelClearsBufferAndSubmitsDirective() throws InterruptedException {
        editor.setText("half typed");

        Command command = editor.cancel().orElseThrow();

        assertEquals("", editor.text());
        assertEquals(Optional.of(ControlDirective.CANCEL), command.directive());
        assertEquals(0, editor.history().size());
    }

    @Test
    void undoSubmitsDirectiveAndKeepsBuffer() throws InterruptedException {
        editor.setText("draft");

        Command command = editor.undo().orElseThrow();

        assertEquals(Optional.of(ControlDirective.UNDO), command.directive());
        assertEquals("draft", editor.text());
    }
}
