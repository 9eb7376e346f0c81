package com.phillippitts.podcastbuddy.service.orchestration;

import com.phillippitts.podcastbuddy.domain.TurnPhase;
import com.phillippitts.podcastbuddy.service.metrics.TurnMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoopTurnMetricsPublisherTest {

    @Test
    void noopInstanceIsDisabled() {
        assertFalse(TurnMetricsPublisher.NOOP.isEnabled());
    }

    @Test
    void noopIsSingleton() {
        assertSame(TurnMetricsPublisher.NOOP, TurnMetricsPublisher.NOOP);
    }

    @Test
    void noopMethodsDoNotThrow() {
        TurnMetricsPublisher noop = TurnMetricsPublisher.NOOP;

        assertDoesNotThrow(() -> noop.recordTurn("user", TurnPhase.COMPLETE, null, 1_000_000L));
        assertDoesNotThrow(() -> noop.recordTurn("user", TurnPhase.FAILED, "model_timeout", 1_000_000L));
        assertDoesNotThrow(() -> noop.recordFirstAudio(500_000L));
        assertDoesNotThrow(noop::recordSentenceDropped);
        assertDoesNotThrow(() -> noop.recordPlaybackFallback("java-sound", true));
    }

    @Test
    void publisherWithMetricsIsEnabled() {
        assertTrue(new TurnMetricsPublisher(new TurnMetrics(new SimpleMeterRegistry())).isEnabled());
    }
}
