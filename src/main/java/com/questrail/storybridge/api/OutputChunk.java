package com.questrail.storybridge.api;

import java.util.Objects;

/**
 * OutputChunk
 * -----------------------------------------------------------------------------
 * One unit of output travelling from the engine worker to the display.
 *
 * <p>The payload is opaque to the bridge. {@link Kind#ERROR} chunks carry a
 * tagged, user-visible failure message. {@link #END_OF_STREAM} is the
 * distinguished terminal marker: once a reader sees it no further chunks will
 * ever follow.</p>
 */
public record OutputChunk(Kind kind, String payload)
{
    public enum Kind {
        TEXT,
        ERROR,
        END_OF_STREAM
    }

    public static final OutputChunk END_OF_STREAM = new OutputChunk(Kind.END_OF_STREAM, "");

    public OutputChunk {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
    }

    public static OutputChunk text(String payload) {
        return new OutputChunk(Kind.TEXT, payload);
    }

    public static OutputChunk error(String payload) {
        return new OutputChunk(Kind.ERROR, payload);
    }

    public boolean isEndOfStream() {
        return kind == Kind.END_OF_STREAM;
    }
}
