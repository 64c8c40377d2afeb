package com.questrail.storybridge.input;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Submitted-line history with a navigation cursor, as found in a terminal
 * line editor. The cursor sits one past the newest entry after every
 * {@link #add(String)}.
 *
 * <p>Not thread-safe; owned by the editor's thread.</p>
 */
public final class CommandHistory
{
    private final int maxEntries;
    private final List<String> entries = new ArrayList<>();
    private int cursor;

    public CommandHistory(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
    }

    public void add(String line) {
        Objects.requireNonNull(line, "line");
        entries.add(line);
        if (entries.size() > maxEntries) {
            entries.remove(0);
        }
        cursor = entries.size();
    }

    /**
     * Moves one entry back, stopping at the oldest.
     *
     * @return the entry under the cursor, or the empty string if there is no history
     */
    public String previous() {
        if (entries.isEmpty()) {
            return "";
        }
        cursor = Math.max(0, cursor - 1);
        return entries.get(cursor);
    }

    /**
     * Moves one entry forward. Moving past the newest entry yields the empty
     * string (a fresh line).
     */
    public String next() {
        if (entries.isEmpty()) {
            return "";
        }
        cursor = Math.min(entries.size(), cursor + 1);
        return cursor < entries.size() ? entries.get(cursor) : "";
    }

    public int size() {
        return entries.size();
    }

    public List<String> entries() {
        return List.copyOf(entries);
    }
}
