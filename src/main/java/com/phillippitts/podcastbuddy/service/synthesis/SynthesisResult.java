package com.phillippitts.podcastbuddy.service.synthesis;

import com.phillippitts.podcastbuddy.domain.AudioBuffer;
import com.phillippitts.podcastbuddy.domain.SentenceUnit;

import java.util.Objects;

/**
 * Outcome of synthesizing one unit: either an {@link AudioBuffer} or a failure tagged with the
 * offending unit.
 *
 * @param unit the unit that was synthesized
 * @param buffer audio on success, null on failure
 * @param failureReason short reason on failure, null on success
 */
public record SynthesisResult(SentenceUnit unit, AudioBuffer buffer, String failureReason) {

    public SynthesisResult {
        Objects.requireNonNull(unit, "unit must not be null");
        if ((buffer == null) == (failureReason == null)) {
            throw new IllegalArgumentException("exactly one of buffer or failureReason must be set");
        }
    }

    public static SynthesisResult success(SentenceUnit unit, AudioBuffer buffer) {
        return new SynthesisResult(unit, buffer, null);
    }

    public static SynthesisResult failure(SentenceUnit unit, String reason) {
        return new SynthesisResult(unit, null, reason);
    }

    public boolean isSuccess() {
        return buffer != null;
    }
}
