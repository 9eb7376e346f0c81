package com.phillippitts.podcastbuddy.service.synthesis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SpeechTextCleanerTest {

    private final SpeechTextCleaner cleaner = new SpeechTextCleaner(500, 200);

    @Test
    void shouldStripMarkupAndCollapseWhitespace() {
        String cleaned = cleaner.clean("## Big **news**: see [the docs](http://x.io) and `code`  now!\n\tReally.");

        assertThat(cleaned).isEqualTo("Big news: see the docs and now! Really.");
    }

    @Test
    void shouldRemoveEmoji() {
        assertThat(cleaner.clean("Great idea 😀🚀 right?")).isEqualTo("Great idea right?");
        assertThat(cleaner.clean("Sunny ☀️ day")).isEqualTo("Sunny day");
    }

    @Test
    void nullOrMarkupOnlyBecomesEmpty() {
        assertThat(cleaner.clean(null)).isEmpty();
        assertThat(cleaner.clean("***  ##")).isEmpty();
    }

    @Test
    void longTextIsCutAtLastPeriodBeyondMinimum() {
        SpeechTextCleaner small = new SpeechTextCleaner(30, 10);

        String cleaned = small.clean("This is sentence one. And this runs on far too long");

        assertThat(cleaned).isEqualTo("This is sentence one.");
    }

    @Test
    void longTextWithoutUsablePeriodIsHardCut() {
        SpeechTextCleaner small = new SpeechTextCleaner(20, 10);

        assertThat(small.clean("Hi. abcdefghijklmnopqrstuvwxyz")).isEqualTo("Hi. abcdefghijklmnop.");
    }
}
