package com.questrail.storybridge.input;

import java.util.Optional;

/**
 * InputValidator
 * -----------------------------------------------------------------------------
 * Decides whether a raw line of input may be enqueued, and normalizes it.
 *
 * <p>A line is rejected when it is null, blank after normalization, longer
 * than {@link #MAX_LINE_LENGTH}, contains an unpaired surrogate (broken
 * encoding), or contains a control character other than tab. Rejected lines
 * are reported and dropped by the caller; they never reach the engine.</p>
 */
public final class InputValidator
{
    public static final int MAX_LINE_LENGTH = 1024;

    private InputValidator() {
    }

    /**
     * Strips surrounding whitespace, including a trailing line terminator.
     */
    public static String normalize(String raw) {
        return raw == null ? null : raw.strip();
    }

    /**
     * @return why {@code raw} must be discarded, or empty if it is acceptable
     */
    public static Optional<String> rejectionReason(String raw) {
        if (raw == null) {
            return Optional.of("null input");
        }
        String line = normalize(raw);
        if (line.isEmpty()) {
            return Optional.of("blank line");
        }
        if (line.length() > MAX_LINE_LENGTH) {
            return Optional.of("line longer than " + MAX_LINE_LENGTH + " characters");
        }
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 < line.length() && Character.isLowSurrogate(line.charAt(i + 1))) {
                    i++;
                    continue;
                }
                return Optional.of("unpaired surrogate at index " + i);
            }
            if (Character.isLowSurrogate(c)) {
                return Optional.of("unpaired surrogate at index " + i);
            }
            if (c != '\t' && Character.isISOControl(c)) {
                return Optional.of(String.format("control character U+%04X at index %d", (int) c, i));
            }
        }
        return Optional.empty();
    }
}
