package com.phillippitts.podcastbuddy.exception;

/**
 * Thrown when an audio device fails to start or finish playing a buffer.
 */
public class PlaybackException extends PodcastBuddyException {

    private final String deviceName;

    public PlaybackException(String message, String deviceName) {
        super(message + " (device: " + deviceName + ")");
        this.deviceName = deviceName;
    }

    public PlaybackException(String message, String deviceName, Throwable cause) {
        super(message + " (device: " + deviceName + ")", cause);
        this.deviceName = deviceName;
    }

    public String getDeviceName() {
        return deviceName;
    }
}
