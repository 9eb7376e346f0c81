package com.phillippitts.podcastbuddy.util;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp taken with
     * {@link System#nanoTime()}.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds left until a {@link System#nanoTime()} deadline, never negative.
     *
     * @param deadlineNanos absolute deadline in nanoTime units
     * @return remaining milliseconds, 0 when the deadline has passed
     */
    public static long remainingMillis(long deadlineNanos) {
        long remaining = (deadlineNanos - System.nanoTime()) / NANOS_PER_MILLI;
        return Math.max(0, remaining);
    }
}
