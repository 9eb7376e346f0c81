package com.phillippitts.podcastbuddy.service.playback.event;

import java.time.Instant;

/** Published when a sentence unit is skipped because synthesis failed. Carries no user text. */
public record SentenceDroppedEvent(String turnId, int sequenceIndex, String reason, Instant at) { }
