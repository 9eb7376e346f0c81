package com.phillippitts.podcastbuddy.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the turn pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>turn latency per kind and outcome</li>
 *   <li>time from turn start to first audio</li>
 *   <li>turn outcomes, including failure causes</li>
 *   <li>dropped sentences and playback fallbacks</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class TurnMetrics {

    private static final String TURN_PREFIX = "podcastbuddy.turn";

    private final MeterRegistry registry;

    public TurnMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param kind turn kind (user, intro, farewell)
     * @param phase terminal phase (complete, cancelled, failed)
     * @param durationNanos turn duration in nanoseconds
     */
    public void recordLatency(String kind, String phase, long durationNanos) {
        Timer.builder(TURN_PREFIX + ".latency")
                .description("Time from turn start until the last sentence finished playing")
                .tag("kind", kind)
                .tag("phase", phase)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordFirstAudio(long durationNanos) {
        Timer.builder(TURN_PREFIX + ".first_audio")
                .description("Time from turn start until the first sentence started playing")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param phase terminal phase
     * @param reason failure cause, or "none"
     */
    public void incrementOutcome(String phase, String reason) {
        Counter.builder(TURN_PREFIX + ".outcome")
                .description("Number of turns by terminal phase")
                .tag("phase", phase)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementSentenceDropped() {
        Counter.builder("podcastbuddy.sentence.dropped")
                .description("Sentences skipped after synthesis failure")
                .register(registry)
                .increment();
    }

    public void incrementPlaybackFallback(String device, boolean recovered) {
        Counter.builder("podcastbuddy.playback.fallback")
                .description("Playback failures on a device")
                .tag("device", device)
                .tag("recovered", String.valueOf(recovered))
                .register(registry)
                .increment();
    }
}
