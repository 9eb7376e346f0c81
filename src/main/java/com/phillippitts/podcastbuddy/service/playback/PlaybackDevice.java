package com.phillippitts.podcastbuddy.service.playback;

import com.phillippitts.podcastbuddy.domain.AudioBuffer;

import java.util.concurrent.CompletableFuture;

/**
 * Audio output that plays one buffer at a time.
 *
 * <p>{@link #play(AudioBuffer)} returns immediately; the returned future completes when the
 * device is idle again (normally after the last sample, exceptionally with a
 * {@link com.phillippitts.podcastbuddy.exception.PlaybackException} if playback could not start or
 * broke off). Devices do not release buffers; the caller owns them.
 */
public interface PlaybackDevice {

    CompletableFuture<Void> play(AudioBuffer buffer);

    /** @return true if the device can be used in the current environment */
    boolean isAvailable();

    /** Name for logs/metrics. */
    String name();
}
