package com.questrail.storybridge.output;

import com.questrail.storybridge.api.OutputChunk;
import com.questrail.storybridge.core.OutputChannel;
import com.questrail.storybridge.internal.time.SystemWallClock;
import com.questrail.storybridge.observability.RecordingObservabilitySink;
import com.questrail.storybridge.test.exec.RecordingTranscriptListener;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TranscriptPumpTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    @Test
    void deliversChunksInOrderThenEndOfStream() throws InterruptedException {
        OutputChannel output = new OutputChannel(4);
        RecordingTranscriptListener listener = new RecordingTranscriptListener();
        TranscriptPump pump = new TranscriptPump(output, listener, Thread::new, SystemWallClock.INSTANCE, sink);
        pump.start();

        output.write(OutputChunk.text("West of House\n"));
        output.write(OutputChunk.error("[input rejected] not a verb"));
        output.write(OutputChunk.text(">"));
        output.close();

        assertTrue(listener.awaitEnd(TIMEOUT));
        assertTrue(pump.awaitFinished(TIMEOUT));
        assertEquals(List.of("West of House\n", ">"), listener.texts());
        assertEquals(List.of("[input rejected] not a verb"), listener.errors());
        assertEquals("West of House\n>", listener.transcript());
    }

    @Test
    void errorsFallBackToTextByDefault() throws InterruptedException {
        OutputChannel output = new OutputChannel(4);
        StringBuilder seen = new StringBuilder();
        TranscriptListener plain = seen::append;
        TranscriptPump pump = new TranscriptPump(output, plain, Thread::new, SystemWallClock.INSTANCE, sink);
        pump.start();

        output.write(OutputChunk.text("a"));
        output.write(OutputChunk.error("b"));
        output.close();

        assertTrue(pump.awaitFinished(TIMEOUT));
        assertEquals("ab", seen.toString());
    }

    @Test
    void failingListenerIsReportedAndPumpContinues() throws InterruptedException {
        OutputChannel output = new OutputChannel(4);
        RecordingTranscriptListener recorder = new RecordingTranscriptListener();
        TranscriptListener flaky = new TranscriptListener() {
            @Override
            public void onText(String text) {
                if (text.equals("boom")) {
                    throw new IllegalStateException("display gone");
                }
                recorder.onText(text);
            }

            @Override
            public void onEndOfStream() {
                recorder.onEndOfStream();
            }
        };
        TranscriptPump pump = new TranscriptPump(output, flaky, Thread::new, SystemWallClock.INSTANCE, sink);
        pump.start();

        output.write(OutputChunk.text("boom"));
        output.write(OutputChunk.text("still here"));
        output.close();

        assertTrue(recorder.awaitEnd(TIMEOUT));
        assertEquals(List.of("still here"), recorder.texts());
        assertEquals(1, sink.getErrors().size());
        assertInstanceOf(IllegalStateException.class, sink.getErrors().get(0).cause());
    }

    @Test
    void stopEndsPumpWithoutEndOfStream() throws InterruptedException {
        OutputChannel output = new OutputChannel(4);
        RecordingTranscriptListener listener = new RecordingTranscriptListener();
        TranscriptPump pump = new TranscriptPump(output, listener, Thread::new, SystemWallClock.INSTANCE, sink);
        pump.start();

        pump.stop();

        assertTrue(pump.awaitFinished(TIMEOUT));
        assertFalse(listener.ended());
    }
}
