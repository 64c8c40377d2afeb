package com.questrail.storybridge.input;

import com.questrail.storybridge.api.Command;
import com.questrail.storybridge.api.CommandSource;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * SpeechInput
 * -----------------------------------------------------------------------------
 * Voice producer: turns recognizer transcripts into voice commands.
 *
 * <p>Transcripts below the configured confidence floor are discarded and
 * reported. Accepted transcripts are lower-cased and stripped of trailing
 * sentence punctuation ("Go north." becomes "go north") before submission.
 * Safe to call from the recognizer's callback thread.</p>
 */
public final class SpeechInput
{
    private final CommandIntake intake;
    private final double minimumConfidence;

    public SpeechInput(CommandIntake intake, double minimumConfidence) {
        this.intake = Objects.requireNonNull(intake, "intake");
        if (minimumConfidence < 0.0 || minimumConfidence > 1.0) {
            throw new IllegalArgumentException("minimumConfidence must be within [0, 1]");
        }
        this.minimumConfidence = minimumConfidence;
    }

    /**
     * @param transcript recognized text
     * @param confidence recognizer confidence in {@code [0, 1]}
     * @return the enqueued command, or empty if the transcript was discarded
     */
    public Optional<Command> onTranscript(String transcript, double confidence) throws InterruptedException {
        if (confidence < minimumConfidence) {
            intake.discarded(CommandSource.VOICE, transcript,
                    String.format(Locale.ROOT, "confidence %.2f below %.2f", confidence, minimumConfidence));
            return Optional.empty();
        }
        return intake.submit(clean(transcript), CommandSource.VOICE);
    }

    static String clean(String transcript) {
        if (transcript == null) {
            return null;
        }
        String text = transcript.strip();
        int end = text.length();
        while (end > 0 && isSentencePunctuation(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end).toLowerCase(Locale.ROOT);
    }

    private static boolean isSentencePunctuation(char c) {
        return c == '.' || c == '!' || c == '?' || c == ',';
    }
}
