package com.questrail.storybridge.output;

/**
 * Display-side receiver of engine output, driven by a {@link TranscriptPump}.
 *
 * <p>Callbacks arrive on the pump thread in the order the engine produced the
 * output. A UI toolkit with its own event thread should hand the text over to
 * that thread.</p>
 */
public interface TranscriptListener
{
    void onText(String text);

    /**
     * A tagged, user-visible failure. By default it is shown like any text.
     */
    default void onError(String message) {
        onText(message);
    }

    /**
     * No further output will ever arrive.
     */
    default void onEndOfStream() {
    }
}
