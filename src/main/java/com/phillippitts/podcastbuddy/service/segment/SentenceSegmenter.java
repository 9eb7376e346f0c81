package com.phillippitts.podcastbuddy.service.segment;

import com.phillippitts.podcastbuddy.domain.SentenceUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a stream of text fragments into {@link SentenceUnit}s as soon as each unit is complete.
 *
 * <p>A sentence ends at {@code .}, {@code !} or {@code ?} followed by whitespace or end of input.
 * No abbreviation or quotation analysis is performed, so {@code "Dr. Smith"} splits after
 * {@code "Dr."}. While streaming, a boundary is only confirmed once non-whitespace text follows
 * it: a terminator at the end of the buffered text may still be continued by the next fragment
 * (for example {@code "3."} then {@code "14"}), and a sentence followed only by whitespace may be
 * the last one of the stream. Such a sentence is held until more text arrives or
 * {@link #finish()} is called, at most one fragment later.
 *
 * <p>{@code sentencesPerUnit} raw sentences are merged into one unit, joined by a single space.
 * Empty or whitespace-only candidates are discarded. Sequence indices start at 0 for every
 * stream.
 *
 * <p><b>Incremental use:</b>
 * <pre>{@code
 * SentenceSegmenter segmenter = new SentenceSegmenter(1);
 * for (String token : tokens) {
 *     segmenter.accept(token).forEach(sink);
 * }
 * segmenter.finish().ifPresent(sink);   // final remainder, isFinal = true
 * }</pre>
 * Units emitted by {@link #accept(String)} are never final. Because the last sentence is always
 * held back, {@link #finish()} returns the last unit of every non-empty stream, marked final.
 *
 * <p><b>Thread Safety:</b> Not thread-safe. One instance per stream; {@link #finish()} resets
 * the instance so it can be reused for the next stream.
 */
public final class SentenceSegmenter {

    private final int sentencesPerUnit;
    private final StringBuilder buffer = new StringBuilder();
    private final List<String> pendingSentences = new ArrayList<>();
    private int scanFrom;
    private int nextIndex;

    public SentenceSegmenter(int sentencesPerUnit) {
        if (sentencesPerUnit < 1) {
            throw new IllegalArgumentException("sentencesPerUnit must be >= 1");
        }
        this.sentencesPerUnit = sentencesPerUnit;
    }

    /**
     * Appends a fragment and returns every unit it completed, in order.
     *
     * @param fragment next piece of model output (null or empty is ignored)
     * @return completed units, possibly empty; never null
     */
    public List<SentenceUnit> accept(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return List.of();
        }
        buffer.append(fragment);
        List<SentenceUnit> completed = new ArrayList<>();
        int boundary;
        while ((boundary = findBoundary()) >= 0) {
            String sentence = buffer.substring(0, boundary + 1).trim();
            buffer.delete(0, boundary + 1);
            scanFrom = 0;
            if (sentence.isEmpty()) {
                continue;
            }
            pendingSentences.add(sentence);
            if (pendingSentences.size() == sentencesPerUnit) {
                completed.add(emit(false));
            }
        }
        // Only a terminator at the last non-whitespace char can still become a boundary
        scanFrom = Math.max(0, lastNonWhitespace());
        return completed;
    }

    /**
     * Flushes the remaining text as the final unit and resets the segmenter.
     *
     * @return the final unit, or empty when nothing remains
     */
    public Optional<SentenceUnit> finish() {
        String remainder = buffer.toString().trim();
        if (!remainder.isEmpty()) {
            pendingSentences.add(remainder);
        }
        Optional<SentenceUnit> last = pendingSentences.isEmpty()
                ? Optional.empty()
                : Optional.of(emit(true));
        reset();
        return last;
    }

    /**
     * Discards any buffered text and restarts sequence numbering at 0.
     */
    public void reset() {
        buffer.setLength(0);
        pendingSentences.clear();
        scanFrom = 0;
        nextIndex = 0;
    }

    /**
     * Segments a complete stream. The last unit is always marked final.
     *
     * @param fragments the full stream of fragments
     * @param sentencesPerUnit sentences merged into one unit
     * @return all units in order
     */
    public static List<SentenceUnit> segment(Iterable<String> fragments, int sentencesPerUnit) {
        SentenceSegmenter segmenter = new SentenceSegmenter(sentencesPerUnit);
        List<SentenceUnit> units = new ArrayList<>();
        for (String fragment : fragments) {
            units.addAll(segmenter.accept(fragment));
        }
        segmenter.finish().ifPresent(units::add);
        return List.copyOf(units);
    }

    /**
     * Segments a complete text. Equivalent to {@code segment(List.of(text), sentencesPerUnit)}.
     */
    public static List<SentenceUnit> split(String text, int sentencesPerUnit) {
        return segment(text == null ? List.of() : List.of(text), sentencesPerUnit);
    }

    private SentenceUnit emit(boolean isFinal) {
        String text = String.join(" ", pendingSentences);
        pendingSentences.clear();
        return new SentenceUnit(text, nextIndex++, isFinal);
    }

    /**
     * @return index of the first terminator followed by whitespace and then more text, or -1
     */
    private int findBoundary() {
        int last = lastNonWhitespace();
        for (int i = scanFrom; i < last - 1; i++) {
            if (isTerminator(buffer.charAt(i)) && Character.isWhitespace(buffer.charAt(i + 1))) {
                return i;
            }
        }
        return -1;
    }

    private int lastNonWhitespace() {
        int i = buffer.length() - 1;
        while (i >= 0 && Character.isWhitespace(buffer.charAt(i))) {
            i--;
        }
        return i;
    }

    private static boolean isTerminator(char c) {
        return c == '.' || c == '!' || c == '?';
    }
}
