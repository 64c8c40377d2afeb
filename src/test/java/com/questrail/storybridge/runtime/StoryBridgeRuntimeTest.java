package com.questrail.storybridge.runtime;

import com.questrail.storybridge.api.CommandSource;
import com.questrail.storybridge.api.ControlDirective;
import com.questrail.storybridge.api.QueueClosedException;
import com.questrail.storybridge.api.StepResult;
import com.questrail.storybridge.api.StoryEngine;
import com.questrail.storybridge.api.WorkerStoppedException;
import com.questrail.storybridge.config.BridgeConfig;
import com.questrail.storybridge.internal.exec.WorkerState;
import com.questrail.storybridge.observability.LifecycleEvent;
import com.questrail.storybridge.observability.RecordingObservabilitySink;
import com.questrail.storybridge.test.exec.RecordingTranscriptListener;
import com.questrail.storybridge.test.exec.ScriptedStoryEngine;
import com.questrail.storybridge.test.exec.ScriptedStoryEngine.Session;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StoryBridgeRuntimeTest
 * -----------------------------------------------------------------------------
 * End-to-end sessions through the composition root: startup gating, producer
 * paths, introspection and every shutdown outcome.
 */
class StoryBridgeRuntimeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private static ScriptedStoryEngine zork() {
        return ScriptedStoryEngine.builder()
                .banner("ZORK I: The Great Underground Empire\n")
                .respond("open mailbox", "Opening the small mailbox reveals a leaflet.")
                .respond("take leaflet", "Taken.")
                .respond("read leaflet", "\"WELCOME TO ZORK!\"")
                .ending("jump", "You jump into the chasm.", "*** You have died ***")
                .build();
    }

    @Test
    void fullSessionFromKeyboardAndVoice() throws Exception {
        RecordingTranscriptListener transcript = new RecordingTranscriptListener();
        StoryBridgeRuntime<Session> runtime = StoryBridgeRuntime.builder(zork())
                .withObservabilitySink(sink)
                .withTranscriptListener(transcript)
                .build();
        runtime.start();
        assertEquals(WorkerState.RUNNING, runtime.workerState());

        runtime.lineEditor().setText("open mailbox");
        runtime.lineEditor().submit();
        awaitTurns(runtime, 1);
        runtime.speechInput().onTranscript("Take leaflet.", 0.9);
        awaitTurns(runtime, 2);
        runtime.submit("read leaflet", CommandSource.KEYBOARD);
        awaitTranscript(transcript, "WELCOME TO ZORK!");

        assertEquals(List.of("open mailbox", "take leaflet", "read leaflet"),
                runtime.query(Session::linesReceived));

        assertEquals(ShutdownOutcome.GRACEFUL, runtime.shutdown());
        assertEquals(WorkerState.STOPPED, runtime.workerState());
        assertTrue(transcript.awaitEnd(TIMEOUT));
        assertTrue(transcript.transcript().contains("Taken."));

        List<LifecycleEvent.Phase> phases = sink.getLifecycleEvents().stream()
                .map(LifecycleEvent::phase)
                .toList();
        assertEquals(List.of(
                LifecycleEvent.Phase.STARTED,
                LifecycleEvent.Phase.SHUTDOWN_REQUESTED,
                LifecycleEvent.Phase.SHUTDOWN_COMPLETE), phases);
    }

    @Test
    void submitBeforeStartIsRefused() {
        StoryBridgeRuntime<Session> runtime = StoryBridgeRuntime.builder(zork()).build();

        assertThrows(IllegalStateException.class, () -> runtime.submit("look", CommandSource.KEYBOARD));
        assertEquals(0, runtime.pendingCommands());
    }

    @Test
    void submitAfterShutdownIsRefused() throws Exception {
        StoryBridgeRuntime<Session> runtime = StoryBridgeRuntime.builder(zork()).build();
        runtime.start();
        runtime.shutdown();

        assertThrows(QueueClosedException.class, () -> runtime.submit("look", CommandSource.KEYBOARD));
        assertThrows(QueueClosedException.class, () -> runtime.submit(ControlDirective.UNDO));
    }

    @Test
    void shutdownWithoutStartClosesEverythingPromptly() throws Exception {
        StoryBridgeRuntime<Session> runtime = StoryBridgeRuntime.builder(zork())
                .withConfig(shortTimeouts(Duration.ofMillis(300)))
                .withObservabilitySink(sink)
                .build();

        long began = System.nanoTime();
        ShutdownOutcome outcome = runtime.shutdown();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - began);

        assertEquals(ShutdownOutcome.NEVER_STARTED, outcome);
        assertTrue(elapsed.compareTo(Duration.ofMillis(200)) < 0, "shutdown waited " + elapsed);
        assertEquals(WorkerState.STOPPED, runtime.workerState());
        assertTrue(runtime.output().readBlocking(TIMEOUT).orElseThrow().isEndOfStream());
        assertThrows(WorkerStoppedException.class, () -> runtime.query(Session::turns));
        assertThrows(QueueClosedException.class, () -> runtime.submit("look", CommandSource.KEYBOARD));
        assertThrows(IllegalStateException.class, runtime::start);
        assertEquals(ShutdownOutcome.ALREADY_STOPPED, runtime.shutdown());
    }

    @Test
    void storyThatEndsOnItsOwnReportsAlreadyStopped() throws Exception {
        RecordingTranscriptListener transcript = new RecordingTranscriptListener();
        StoryBridgeRuntime<Session> runtime = StoryBridgeRuntime.builder(zork())
                .withTranscriptListener(transcript)
                .build();
        runtime.start();

        runtime.submit("jump", CommandSource.VOICE);

        assertTrue(transcript.awaitEnd(TIMEOUT));
        assertTrue(transcript.transcript().endsWith("*** You have died ***"));
        assertEquals(ShutdownOutcome.ALREADY_STOPPED, runtime.shutdown());
    }

    @Test
    void startupFailureThrowsAndLeavesIntakeClosed() throws Exception {
        RecordingTranscriptListener transcript = new RecordingTranscriptListener();
        StoryBridgeRuntime<Object> runtime = StoryBridgeRuntime.builder(new StoryEngine<Object>() {
                    @Override
                    public Object open() throws Exception {
                        throw new IOException("zork1.z5: no such file");
                    }

                    @Override
                    public StepResult step(Object state) {
                        return StepResult.halted();
                    }

                    @Override
                    public void feedLine(Object state, String line) {
                    }
                })
                .withTranscriptListener(transcript)
                .build();

        IllegalStateException e = assertThrows(IllegalStateException.class, runtime::start);
        assertTrue(e.getMessage().contains("failed to start"));
        assertThrows(QueueClosedException.class, () -> runtime.submit("look", CommandSource.KEYBOARD));

        assertTrue(transcript.awaitEnd(TIMEOUT));
        assertEquals(List.of("[fatal] zork1.z5: no such file"), transcript.errors());
        assertEquals(ShutdownOutcome.ALREADY_STOPPED, runtime.shutdown());
    }

    @Test
    void blockedStepIsInterruptedByForcedShutdown() throws Exception {
        CountDownLatch neverReleased = new CountDownLatch(1);
        CountDownLatch stepping = new CountDownLatch(1);
        StoryBridgeRuntime<Object> runtime = StoryBridgeRuntime.builder(new StoryEngine<Object>() {
                    @Override
                    public Object open() {
                        return new Object();
                    }

                    @Override
                    public StepResult step(Object state) throws InterruptedException {
                        stepping.countDown();
                        neverReleased.await();
                        return StepResult.proceed();
                    }

                    @Override
                    public void feedLine(Object state, String line) {
                    }
                })
                .withConfig(shortTimeouts(TIMEOUT))
                .withObservabilitySink(sink)
                .build();
        runtime.start();
        assertTrue(stepping.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));

        assertEquals(ShutdownOutcome.FORCED, runtime.shutdown());
        assertEquals(WorkerState.STOPPED, runtime.workerState());
        assertTrue(sink.getLifecycleEvents().stream()
                .anyMatch(ev -> ev.phase() == LifecycleEvent.Phase.FORCE_STOP_REQUESTED));
    }

    @Test
    void workerIgnoringInterruptIsReportedUnresponsive() throws Exception {
        Spinner spinner = new Spinner();
        StoryBridgeRuntime<Object> runtime = StoryBridgeRuntime.builder(spinner)
                .withConfig(shortTimeouts(Duration.ofMillis(200)))
                .build();
        try {
            runtime.start();
            assertTrue(spinner.spinning.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));

            assertEquals(ShutdownOutcome.UNRESPONSIVE, runtime.shutdown());
            assertNotEquals(WorkerState.STOPPED, runtime.workerState());
        } finally {
            spinner.release = true;
        }
    }

    @Test
    void queryRunsWhileSessionIsIdle() throws Exception {
        StoryBridgeRuntime<Session> runtime = StoryBridgeRuntime.builder(zork()).build();
        runtime.start();
        try {
            assertEquals(0, runtime.query(Session::turns));
            assertFalse(runtime.queryAsync(Session::halted).get());
        } finally {
            runtime.shutdown();
        }
    }

    private static BridgeConfig shortTimeouts(Duration forceStopTimeout) {
        return BridgeConfig.builder()
                .withShutdownTimeout(Duration.ofMillis(200))
                .withForceStopTimeout(forceStopTimeout)
                .build();
    }

    private static void awaitTranscript(RecordingTranscriptListener transcript, String text)
            throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!transcript.transcript().contains(text)) {
            assertTrue(System.nanoTime() < deadline, "transcript never showed " + text);
            Thread.sleep(10);
        }
    }

    private static void awaitTurns(StoryBridgeRuntime<Session> runtime, int turns) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (runtime.query(Session::turns) < turns) {
            assertTrue(System.nanoTime() < deadline, "story did not reach turn " + turns);
            Thread.sleep(10);
        }
    }

    /**
     * Engine whose first step busy-waits and never checks for interruption.
     */
    private static final class Spinner implements StoryEngine<Object> {
        final CountDownLatch spinning = new CountDownLatch(1);
        volatile boolean release;

        @Override
        public Object open() {
            return new Object();
        }

        @Override
        public StepResult step(Object state) {
            spinning.countDown();
            while (!release) {
                Thread.onSpinWait();
            }
            return StepResult.halted();
        }

        @Override
        public void feedLine(Object state, String line) {
        }
    }
}
