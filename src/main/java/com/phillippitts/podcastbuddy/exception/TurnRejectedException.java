package com.phillippitts.podcastbuddy.exception;

/**
 * Thrown when a turn is requested while another turn of the same session is still in flight.
 */
public class TurnRejectedException extends PodcastBuddyException {

    private final String activeTurnId;

    public TurnRejectedException(String activeTurnId) {
        super("Turn already in flight: " + activeTurnId);
        this.activeTurnId = activeTurnId;
    }

    public String getActiveTurnId() {
        return activeTurnId;
    }
}
