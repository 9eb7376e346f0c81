package com.phillippitts.podcastbuddy.exception;

/**
 * Base exception for all podcast-buddy application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class PodcastBuddyException extends RuntimeException {

    public PodcastBuddyException(String message) {
        super(message);
    }

    public PodcastBuddyException(String message, Throwable cause) {
        super(message, cause);
    }

    public PodcastBuddyException(Throwable cause) {
        super(cause);
    }
}
