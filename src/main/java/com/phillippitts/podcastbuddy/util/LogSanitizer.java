package com.phillippitts.podcastbuddy.util;

/** Utility for privacy-safe logging of spoken text and user input. */
public final class LogSanitizer {

    /** Default preview length for user input and model output in logs. */
    public static final int PREVIEW_CHARS = 60;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview of at most {@link #PREVIEW_CHARS} characters.
     */
    public static String preview(String s) {
        return truncate(s, PREVIEW_CHARS).replace('\n', ' ').replace('\r', ' ');
    }
}
