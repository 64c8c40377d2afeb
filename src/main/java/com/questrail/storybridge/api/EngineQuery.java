package com.questrail.storybridge.api;

/**
 * EngineQuery
 * -----------------------------------------------------------------------------
 * A read-only function over engine state, executed on the engine worker
 * thread on behalf of another thread.
 *
 * <p>Implementations must not mutate the state, must not block and must
 * return plain data (copies), never references into the state itself. The
 * bridge does not enforce any of this; it only guarantees that no engine
 * step runs while the query does.</p>
 *
 * @param <S> engine state type
 * @param <T> result type
 */
@FunctionalInterface
public interface EngineQuery<S, T>
{
    T read(S state) throws Exception;
}
