package com.phillippitts.podcastbuddy.service.synthesis;

import java.util.regex.Pattern;

/**
 * Strips markup and symbols a voice should not read aloud and bounds the text length.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>emphasis asterisks and heading markers are removed</li>
 *   <li>{@code [label](url)} becomes {@code label}</li>
 *   <li>inline code spans are removed</li>
 *   <li>emoji and pictographic symbols are removed</li>
 *   <li>whitespace runs collapse to one space</li>
 *   <li>text longer than {@code maxChars} is cut at the last period before the cap when that
 *       period lies beyond {@code minBoundaryChars}, otherwise hard-cut at the cap with a
 *       period appended</li>
 * </ol>
 */
public final class SpeechTextCleaner {

    private static final Pattern ASTERISKS = Pattern.compile("\\*+");
    private static final Pattern HEADINGS = Pattern.compile("#+\\s*");
    private static final Pattern LINKS = Pattern.compile("\\[([^\\]]+)\\]\\([^)]+\\)");
    private static final Pattern CODE_SPANS = Pattern.compile("`[^`]*`");
    private static final Pattern EMOJI = Pattern.compile(
            "[\\x{1F600}-\\x{1F64F}\\x{1F300}-\\x{1F5FF}\\x{1F680}-\\x{1F6FF}"
                    + "\\x{1F1E0}-\\x{1F1FF}\\x{2600}-\\x{27BF}\\x{FE0F}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxChars;
    private final int minBoundaryChars;

    public SpeechTextCleaner(int maxChars, int minBoundaryChars) {
        if (maxChars < 1) {
            throw new IllegalArgumentException("maxChars must be >= 1");
        }
        this.maxChars = maxChars;
        this.minBoundaryChars = minBoundaryChars;
    }

    /**
     * @param text raw model output (may be null)
     * @return speakable text, possibly empty
     */
    public String clean(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = ASTERISKS.matcher(text).replaceAll("");
        cleaned = HEADINGS.matcher(cleaned).replaceAll("");
        cleaned = LINKS.matcher(cleaned).replaceAll("$1");
        cleaned = CODE_SPANS.matcher(cleaned).replaceAll("");
        cleaned = EMOJI.matcher(cleaned).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        return limit(cleaned);
    }

    private String limit(String text) {
        if (text.length() <= maxChars) {
            return text;
        }
        int idx = text.lastIndexOf('.', maxChars - 1);
        if (idx > minBoundaryChars) {
            return text.substring(0, idx + 1);
        }
        return text.substring(0, maxChars) + ".";
    }
}
