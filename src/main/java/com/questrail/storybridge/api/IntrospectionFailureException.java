package com.questrail.storybridge.api;

/**
 * Wraps a checked exception raised inside an {@link EngineQuery}.
 *
 * <p>Unchecked exceptions and errors raised by a query are re-thrown to the
 * caller unchanged; only checked ones need this wrapper.</p>
 */
public final class IntrospectionFailureException extends RuntimeException
{
    public IntrospectionFailureException(Throwable cause) {
        super("Engine query failed: " + cause, cause);
    }
}
