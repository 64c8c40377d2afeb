package com.questrail.storybridge.api;

/**
 * CommandSource
 * -----------------------------------------------------------------------------
 * Origin of a submitted line of input.
 *
 * <p>Each source carries a default priority. Higher values are served first.
 * {@link #SYSTEM} is reserved for control directives and always outranks the
 * interactive sources.</p>
 */
public enum CommandSource
{
    KEYBOARD(0),
    VOICE(1),
    SYSTEM(Integer.MAX_VALUE);

    private final int defaultPriority;

    CommandSource(int defaultPriority) {
        this.defaultPriority = defaultPriority;
    }

    public int defaultPriority() {
        return defaultPriority;
    }
}
