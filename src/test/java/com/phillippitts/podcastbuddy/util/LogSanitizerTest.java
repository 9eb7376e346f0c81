package com.phillippitts.podcastbuddy.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndLimits() {
        assertThat(LogSanitizer.truncate(null, 5)).isEmpty();
        assertThat(LogSanitizer.truncate("abcdef", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("ab", 3)).isEqualTo("ab");
    }

    @Test
    void previewIsSingleLineAndBounded() {
        String preview = LogSanitizer.preview("line one\nline two\r\n" + "x".repeat(100));

        assertThat(preview).doesNotContain("\n").doesNotContain("\r");
        assertThat(preview).hasSize(LogSanitizer.PREVIEW_CHARS);
    }
}
