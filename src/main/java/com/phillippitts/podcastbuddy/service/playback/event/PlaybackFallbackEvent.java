package com.phillippitts.podcastbuddy.service.playback.event;

import java.time.Instant;

/**
 * Published when a playback device fails. {@code recovered} is false when no further device
 * could play the buffer and the unit was skipped.
 */
public record PlaybackFallbackEvent(String device, String reason, boolean recovered, Instant at) { }
