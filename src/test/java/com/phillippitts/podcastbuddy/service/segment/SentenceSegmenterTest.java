package com.phillippitts.podcastbuddy.service.segment;

import com.phillippitts.podcastbuddy.domain.SentenceUnit;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SentenceSegmenterTest {

    @Test
    void shouldSplitOnTerminatorFollowedByWhitespace() {
        List<SentenceUnit> units = SentenceSegmenter.split("Hello world. How are you? Great!", 1);

        assertThat(units).extracting(SentenceUnit::text)
                .containsExactly("Hello world.", "How are you?", "Great!");
        assertThat(units).extracting(SentenceUnit::sequenceIndex).containsExactly(0, 1, 2);
        assertThat(units).extracting(SentenceUnit::isFinal).containsExactly(false, false, true);
    }

    @Test
    void shouldMergeSentencesPerUnit() {
        List<SentenceUnit> units = SentenceSegmenter.split("Hello world. How are you? Great!", 2);

        assertThat(units).extracting(SentenceUnit::text)
                .containsExactly("Hello world. How are you?", "Great!");
        assertThat(units.get(1).isFinal()).isTrue();
    }

    @Test
    void shouldEmitUnitsAsSoonAsTheyCompleteWhileStreaming() {
        SentenceSegmenter segmenter = new SentenceSegmenter(1);

        assertThat(segmenter.accept("Hello")).isEmpty();
        assertThat(segmenter.accept(" world.")).isEmpty();
        List<SentenceUnit> afterSpace = segmenter.accept(" How");

        assertThat(afterSpace).extracting(SentenceUnit::text).containsExactly("Hello world.");
        assertThat(afterSpace.get(0).isFinal()).isFalse();

        Optional<SentenceUnit> last = segmenter.finish();
        assertThat(last).isPresent();
        assertThat(last.get().text()).isEqualTo("How");
        assertThat(last.get().isFinal()).isTrue();
        assertThat(last.get().sequenceIndex()).isEqualTo(1);
    }

    @Test
    void terminatorAtBufferEndWaitsForNextFragment() {
        SentenceSegmenter segmenter = new SentenceSegmenter(1);

        assertThat(segmenter.accept("Pi is 3.")).isEmpty();
        assertThat(segmenter.accept("14 roughly. ")).isEmpty();
        assertThat(segmenter.accept("Yes")).extracting(SentenceUnit::text)
                .containsExactly("Pi is 3.14 roughly.");
    }

    @Test
    void streamEndingWithTrailingWhitespaceStillEndsOnFinalUnit() {
        // Arrange
        SentenceSegmenter segmenter = new SentenceSegmenter(1);
        List<SentenceUnit> units = new ArrayList<>();

        // Act
        units.addAll(segmenter.accept("Hello world. "));
        units.addAll(segmenter.accept("Great! "));
        segmenter.finish().ifPresent(units::add);

        // Assert
        assertThat(units).extracting(SentenceUnit::text).containsExactly("Hello world.", "Great!");
        assertThat(units).extracting(SentenceUnit::isFinal).containsExactly(false, true);
        assertThat(units).extracting(SentenceUnit::sequenceIndex).containsExactly(0, 1);
    }

    @Test
    void sentenceFollowedOnlyByWhitespaceIsHeldUntilMoreTextArrives() {
        SentenceSegmenter segmenter = new SentenceSegmenter(1);

        assertThat(segmenter.accept("First. ")).isEmpty();
        assertThat(segmenter.accept("  ")).isEmpty();
        List<SentenceUnit> released = segmenter.accept("Second");

        assertThat(released).extracting(SentenceUnit::text).containsExactly("First.");
        assertThat(released.get(0).isFinal()).isFalse();
    }

    @Test
    void noAbbreviationHandlingIsAttempted() {
        assertThat(SentenceSegmenter.split("Dr. Smith is here.", 1)).extracting(SentenceUnit::text)
                .containsExactly("Dr.", "Smith is here.");
    }

    @Test
    void fragmentBoundariesDoNotChangeTheResult() {
        String text = "One. Two! Three? Four";
        List<String> singleChars = new ArrayList<>();
        for (char c : text.toCharArray()) {
            singleChars.add(String.valueOf(c));
        }

        assertThat(SentenceSegmenter.segment(singleChars, 1)).isEqualTo(SentenceSegmenter.split(text, 1));
    }

    @Test
    void streamEndingOnBoundaryEndsOnFinalUnitInBatchMode() {
        List<SentenceUnit> units = SentenceSegmenter.segment(List.of("First. ", "Second. "), 1);

        assertThat(units).extracting(SentenceUnit::text).containsExactly("First.", "Second.");
        assertThat(units.get(1).isFinal()).isTrue();
    }

    @Test
    void whitespaceOnlyCandidatesAreDiscarded() {
        assertThat(SentenceSegmenter.split("   ", 1)).isEmpty();
        assertThat(SentenceSegmenter.split(null, 1)).isEmpty();

        List<SentenceUnit> units = SentenceSegmenter.segment(List.of("Hi. ", "   "), 1);

        assertThat(units).extracting(SentenceUnit::text).containsExactly("Hi.");
        assertThat(units.get(0).isFinal()).isTrue();
    }

    @Test
    void finishTwiceIsIdempotent() {
        SentenceSegmenter segmenter = new SentenceSegmenter(1);
        segmenter.accept("Tail without end");

        assertThat(segmenter.finish()).isPresent();
        assertThat(segmenter.finish()).isEmpty();
    }

    @Test
    void finishResetsSequenceNumbering() {
        SentenceSegmenter segmenter = new SentenceSegmenter(1);
        segmenter.accept("A. B. ");
        segmenter.finish();

        List<SentenceUnit> next = segmenter.accept("C. D");

        assertThat(next.get(0).sequenceIndex()).isZero();
    }

    @Test
    void shouldRejectNonPositiveUnitSize() {
        assertThatThrownBy(() -> new SentenceSegmenter(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
