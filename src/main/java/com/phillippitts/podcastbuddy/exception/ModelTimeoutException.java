package com.phillippitts.podcastbuddy.exception;

/**
 * Thrown when the language model does not produce output within the configured timeout.
 */
public class ModelTimeoutException extends PodcastBuddyException {

    private final long timeoutMs;

    public ModelTimeoutException(long timeoutMs) {
        super("No model output within " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public ModelTimeoutException(String message, long timeoutMs, Throwable cause) {
        super(message, cause);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
