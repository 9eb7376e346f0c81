package com.phillippitts.podcastbuddy.service.orchestration;

import com.phillippitts.podcastbuddy.domain.TurnPhase;
import com.phillippitts.podcastbuddy.service.metrics.TurnMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Null-safe facade over {@link TurnMetrics} for orchestration code.
 *
 * <p>All methods tolerate a missing {@link TurnMetrics}, so orchestrators can run without a
 * meter registry in tests.
 *
 * @see TurnMetrics
 */
@Component
public final class TurnMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(TurnMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests.
     */
    public static final TurnMetricsPublisher NOOP = new TurnMetricsPublisher(null);

    private final TurnMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public TurnMetricsPublisher(TurnMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("TurnMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordTurn(String kind, TurnPhase phase, String failureReason, long durationNanos) {
        if (metrics == null) {
            return;
        }
        String phaseTag = phase.name().toLowerCase(Locale.ROOT);
        metrics.recordLatency(kind, phaseTag, durationNanos);
        metrics.incrementOutcome(phaseTag, failureReason == null ? "none" : failureReason);
    }

    public void recordFirstAudio(long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordFirstAudio(durationNanos);
    }

    public void recordSentenceDropped() {
        if (metrics == null) {
            return;
        }
        metrics.incrementSentenceDropped();
    }

    public void recordPlaybackFallback(String device, boolean recovered) {
        if (metrics == null) {
            return;
        }
        metrics.incrementPlaybackFallback(device, recovered);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
