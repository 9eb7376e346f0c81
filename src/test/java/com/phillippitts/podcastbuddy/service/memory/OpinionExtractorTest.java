package com.phillippitts.podcastbuddy.service.memory;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OpinionExtractorTest {

    private final OpinionExtractor extractor = new OpinionExtractor();

    @Test
    void shouldKeepWholeStatementWhenMarkerPresent() {
        assertThat(extractor.extract("  Honestly, Pluto is a planet ")).contains("Honestly, Pluto is a planet");
        assertThat(extractor.extract("I DON'T LIKE jazz")).contains("I DON'T LIKE jazz");
    }

    @Test
    void shouldIgnorePlainStatements() {
        assertThat(extractor.extract("what is a quasar")).isEmpty();
        assertThat(extractor.extract("")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }
}
