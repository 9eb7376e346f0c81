package com.phillippitts.podcastbuddy.util;

import java.time.Duration;

/**
 * Standard timeout values for external process management.
 *
 * <p>Used by {@link com.phillippitts.podcastbuddy.service.process.ProcessRunner} for the Piper
 * synthesis process and the command-line playback fallback.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
