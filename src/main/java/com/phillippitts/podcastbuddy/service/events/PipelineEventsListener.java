package com.phillippitts.podcastbuddy.service.events;

import com.phillippitts.podcastbuddy.domain.TurnPhase;
import com.phillippitts.podcastbuddy.service.orchestration.TurnMetricsPublisher;
import com.phillippitts.podcastbuddy.service.orchestration.event.TurnCompletedEvent;
import com.phillippitts.podcastbuddy.service.playback.event.PlaybackFallbackEvent;
import com.phillippitts.podcastbuddy.service.playback.event.SentenceDroppedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central handler for degraded-pipeline events. Counts every event and logs operator hints,
 * throttled to avoid log spam.
 */
@Component
class PipelineEventsListener {
    private static final Logger LOG = LogManager.getLogger(PipelineEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final TurnMetricsPublisher metrics;

    PipelineEventsListener(TurnMetricsPublisher metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onSentenceDropped(SentenceDroppedEvent e) {
        metrics.recordSentenceDropped();
        if (shouldLog("sentence-dropped")) {
            LOG.warn("Dropped sentence {} of turn {}: {}. Check the synthesis binary and voice model.",
                    e.sequenceIndex(), e.turnId(), e.reason());
        }
    }

    @EventListener
    void onPlaybackFallback(PlaybackFallbackEvent e) {
        metrics.recordPlaybackFallback(e.device(), e.recovered());
        String key = "playback-" + e.device() + '-' + e.recovered();
        if (shouldLog(key)) {
            if (e.recovered()) {
                LOG.warn("Audio device {} failing ({}); external player in use.", e.device(), e.reason());
            } else {
                LOG.warn("Audio device {} failing ({}) and no fallback worked. Check audio output and "
                        + "podcast.playback.fallback-command.", e.device(), e.reason());
            }
        }
    }

    @EventListener
    void onTurnCompleted(TurnCompletedEvent e) {
        if (e.phase() != TurnPhase.FAILED) {
            return;
        }
        String key = "turn-failed-" + e.failureReason();
        if (shouldLog(key)) {
            LOG.warn("Turn {} failed: reason={}. Is the language model server running?",
                    e.turnId(), e.failureReason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
