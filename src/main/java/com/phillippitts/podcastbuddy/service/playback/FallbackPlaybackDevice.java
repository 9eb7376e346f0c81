package com.phillippitts.podcastbuddy.service.playback;

import com.phillippitts.podcastbuddy.domain.AudioBuffer;
import com.phillippitts.podcastbuddy.service.playback.event.PlaybackFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Plays through a primary device and, if it fails, tries an alternate device exactly once.
 *
 * <p>When both fail the failure is logged and the returned future still completes normally:
 * a broken speaker must not stall the turn.
 */
public class FallbackPlaybackDevice implements PlaybackDevice {

    private static final Logger LOG = LogManager.getLogger(FallbackPlaybackDevice.class);

    private final PlaybackDevice primary;
    private final PlaybackDevice fallback;
    private final ApplicationEventPublisher publisher;

    /**
     * @param primary preferred device
     * @param fallback alternate device (nullable: no fallback)
     * @param publisher publisher for {@link PlaybackFallbackEvent}s
     */
    public FallbackPlaybackDevice(PlaybackDevice primary, PlaybackDevice fallback,
                                  ApplicationEventPublisher publisher) {
        this.primary = Objects.requireNonNull(primary, "primary must not be null");
        this.fallback = fallback;
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    @Override
    public CompletableFuture<Void> play(AudioBuffer buffer) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        CompletableFuture<Void> first = primary.isAvailable()
                ? startSafely(primary, buffer)
                : CompletableFuture.failedFuture(new IllegalStateException("device unavailable"));

        first.whenComplete((ok, primaryError) -> {
            if (primaryError == null) {
                result.complete(null);
                return;
            }
            String reason = reason(primaryError);
            LOG.warn("Playback via {} failed for unit {}: {}", primary.name(), buffer.sequenceIndex(), reason);
            if (fallback == null || !fallback.isAvailable()) {
                LOG.error("No fallback playback device; skipping unit {}", buffer.sequenceIndex());
                publisher.publishEvent(new PlaybackFallbackEvent(primary.name(), reason, false, Instant.now()));
                result.complete(null);
                return;
            }
            startSafely(fallback, buffer).whenComplete((ok2, fallbackError) -> {
                boolean recovered = fallbackError == null;
                if (recovered) {
                    LOG.info("Unit {} played via fallback {}", buffer.sequenceIndex(), fallback.name());
                } else {
                    LOG.error("Fallback playback via {} failed for unit {}: {}; skipping",
                            fallback.name(), buffer.sequenceIndex(), reason(fallbackError));
                }
                publisher.publishEvent(new PlaybackFallbackEvent(primary.name(), reason, recovered, Instant.now()));
                result.complete(null);
            });
        });
        return result;
    }

    @Override
    public boolean isAvailable() {
        return primary.isAvailable() || (fallback != null && fallback.isAvailable());
    }

    @Override
    public String name() {
        return fallback == null ? primary.name() : primary.name() + "+" + fallback.name();
    }

    private static CompletableFuture<Void> startSafely(PlaybackDevice device, AudioBuffer buffer) {
        try {
            CompletableFuture<Void> future = device.play(buffer);
            return future == null ? CompletableFuture.completedFuture(null) : future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static String reason(Throwable t) {
        Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
