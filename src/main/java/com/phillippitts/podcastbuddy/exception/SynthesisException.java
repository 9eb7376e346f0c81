package com.phillippitts.podcastbuddy.exception;

/**
 * Thrown when a synthesis engine fails to produce audio for a piece of text.
 * This may occur due to engine errors, timeout, or contention on the engine lock.
 */
public class SynthesisException extends PodcastBuddyException {

    private final String engineName;

    public SynthesisException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public SynthesisException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public SynthesisException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
