package com.phillippitts.podcastbuddy.exception;

/**
 * Thrown when the language-model server cannot be reached or the token stream breaks.
 */
public class ModelUnavailableException extends PodcastBuddyException {

    private final String endpoint;

    public ModelUnavailableException(String message) {
        super(message);
        this.endpoint = "unknown";
    }

    public ModelUnavailableException(String message, String endpoint, Throwable cause) {
        super(message + " (endpoint: " + endpoint + ")", cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
