package com.phillippitts.podcastbuddy.service.orchestration.event;

import com.phillippitts.podcastbuddy.domain.TurnPhase;

import java.time.Instant;

/**
 * Published when a turn reaches a terminal phase. Carries no user or model text.
 */
public record TurnCompletedEvent(
        String sessionId,
        String turnId,
        String kind,
        TurnPhase phase,
        String failureReason,
        long durationMs,
        int unitsPlayed,
        int unitsDropped,
        Instant at
) { }
