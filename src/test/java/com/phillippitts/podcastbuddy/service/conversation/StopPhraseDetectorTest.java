package com.phillippitts.podcastbuddy.service.conversation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StopPhraseDetectorTest {

    private final StopPhraseDetector detector = new StopPhraseDetector(List.of("stop podcast", " Goodbye ", ""));

    @Test
    void matchesWholeUtteranceIgnoringCaseAndPadding() {
        assertThat(detector.isStopPhrase("Stop Podcast")).isTrue();
        assertThat(detector.isStopPhrase("  goodbye  ")).isTrue();
    }

    @Test
    void doesNotMatchSubstringsBlankOrNull() {
        assertThat(detector.isStopPhrase("please stop podcast now")).isFalse();
        assertThat(detector.isStopPhrase("")).isFalse();
        assertThat(detector.isStopPhrase(null)).isFalse();
    }
}
