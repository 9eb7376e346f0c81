package com.phillippitts.podcastbuddy.domain;

import java.util.Objects;

/**
 * A minimal independently speakable chunk of model output: one sentence, or a configured
 * group of consecutive sentences.
 *
 * @param text trimmed, non-empty text
 * @param sequenceIndex zero-based position within the turn's stream
 * @param isFinal true when this is the last unit of the stream
 */
public record SentenceUnit(String text, int sequenceIndex, boolean isFinal) {

    public SentenceUnit {
        Objects.requireNonNull(text, "text must not be null");
        if (text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        if (sequenceIndex < 0) {
            throw new IllegalArgumentException("sequenceIndex must be >= 0");
        }
    }
}
