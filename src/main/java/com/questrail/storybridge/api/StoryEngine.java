package com.questrail.storybridge.api;

/**
 * StoryEngine
 * -----------------------------------------------------------------------------
 * Port to the external text-adventure interpreter.
 *
 * <h2>Ownership</h2>
 * The engine state {@code S} is created by {@link #open()} on the engine
 * worker thread and is only ever handed back to this interface (and to
 * {@link EngineQuery} instances) on that same thread. No reference to it is
 * published to producer or consumer threads.
 *
 * <h2>Failure semantics</h2>
 * <ul>
 *   <li>An exception from {@link #open()} or {@link #step(Object)} is fatal:
 *       the worker reports it as a final error chunk and stops.</li>
 *   <li>An exception from {@link #feedLine(Object, String)} rejects that line
 *       only; the worker reports it and keeps waiting for input.</li>
 * </ul>
 *
 * @param <S> engine state type, owned by the worker
 */
public interface StoryEngine<S>
{
    /**
     * Loads the story and builds the initial engine state.
     */
    S open() throws Exception;

    /**
     * Advances execution by one unit.
     */
    StepResult step(S state) throws Exception;

    /**
     * Delivers the next input line. Only called after {@link #step(Object)}
     * returned {@link StepResult.Kind#NEEDS_INPUT}.
     */
    void feedLine(S state, String line) throws Exception;

    /**
     * Releases engine resources. Called once on the worker thread while the
     * worker is stopping, provided {@link #open()} succeeded.
     */
    default void close(S state) throws Exception {
    }
}
