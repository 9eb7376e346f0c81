package com.phillippitts.podcastbuddy.service.playback;

import com.phillippitts.podcastbuddy.domain.AudioBuffer;
import com.phillippitts.podcastbuddy.domain.SentenceUnit;
import com.phillippitts.podcastbuddy.service.playback.event.SentenceDroppedEvent;
import com.phillippitts.podcastbuddy.service.synthesis.SynthesisResult;
import com.phillippitts.podcastbuddy.service.synthesis.SynthesisWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BooleanSupplier;

/**
 * Plays a turn's sentence units in order, one at a time, while the next unit is being
 * synthesized.
 *
 * <p>{@link #admit(SentenceUnit)} runs on the turn thread:
 * <ol>
 *   <li>cancellation checkpoint</li>
 *   <li>synthesize the unit (overlaps playback of the previous unit)</li>
 *   <li>on synthesis failure drop the unit, publish {@link SentenceDroppedEvent} and return</li>
 *   <li>wait for the previous unit to finish playing, then release its buffer</li>
 *   <li>cancellation checkpoint; a cancelled unit is released unplayed</li>
 *   <li>start playback without waiting for it</li>
 * </ol>
 * So at most two units are in flight (one playing, one synthesizing), no two playbacks overlap,
 * and every buffer is released exactly once after it played or was discarded.
 *
 * <p>{@link #finish()} waits for the last unit; {@link #abandon()} stops admitting, lets the
 * playing unit finish and releases it.
 *
 * <p><b>Thread Safety:</b> One sequencer per turn, driven by a single thread. The cancellation
 * flag may be flipped from any thread.
 */
public final class PlaybackSequencer {

    private static final Logger LOG = LogManager.getLogger(PlaybackSequencer.class);

    private final SynthesisWorker worker;
    private final PlaybackDevice device;
    private final ApplicationEventPublisher publisher;
    private final BooleanSupplier cancelled;
    private final String turnId;

    private AudioBuffer playing;
    private CompletableFuture<Void> playback;
    private int lastIndex = -1;
    private int unitsPlayed;
    private int unitsDropped;
    private long firstAudioNanos = -1;
    private boolean closed;

    public PlaybackSequencer(SynthesisWorker worker,
                             PlaybackDevice device,
                             ApplicationEventPublisher publisher,
                             BooleanSupplier cancelled,
                             String turnId) {
        this.worker = Objects.requireNonNull(worker, "worker must not be null");
        this.device = Objects.requireNonNull(device, "device must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.cancelled = Objects.requireNonNull(cancelled, "cancelled must not be null");
        this.turnId = turnId;
    }

    /**
     * Synthesizes and schedules one unit. Blocks until the previous unit has finished playing.
     *
     * @throws IllegalStateException if the sequencer was finished or abandoned
     * @throws IllegalArgumentException if the unit is out of order
     */
    public void admit(SentenceUnit unit) {
        Objects.requireNonNull(unit, "unit must not be null");
        if (closed) {
            throw new IllegalStateException("sequencer already closed");
        }
        if (unit.sequenceIndex() <= lastIndex) {
            throw new IllegalArgumentException("unit " + unit.sequenceIndex() + " admitted after " + lastIndex);
        }
        lastIndex = unit.sequenceIndex();

        if (cancelled.getAsBoolean()) {
            LOG.debug("Turn cancelled; discarding unit {} before synthesis", unit.sequenceIndex());
            return;
        }

        SynthesisResult result = worker.synthesize(unit);
        if (!result.isSuccess()) {
            unitsDropped++;
            publisher.publishEvent(new SentenceDroppedEvent(turnId, unit.sequenceIndex(),
                    result.failureReason(), Instant.now()));
            return;
        }

        awaitPlaying();

        AudioBuffer buffer = result.buffer();
        if (cancelled.getAsBoolean()) {
            LOG.debug("Turn cancelled; discarding unit {} before playback", unit.sequenceIndex());
            buffer.release();
            return;
        }
        start(buffer);
    }

    /**
     * Waits for the last unit to finish playing and releases it.
     */
    public void finish() {
        closed = true;
        awaitPlaying();
    }

    /**
     * Stops admitting units. The unit currently playing is allowed to finish, then released.
     */
    public void abandon() {
        closed = true;
        awaitPlaying();
    }

    public int unitsPlayed() {
        return unitsPlayed;
    }

    public int unitsDropped() {
        return unitsDropped;
    }

    /**
     * @return {@link System#nanoTime()} at which the first unit started playing, if any
     */
    public OptionalLong firstAudioNanos() {
        return firstAudioNanos < 0 ? OptionalLong.empty() : OptionalLong.of(firstAudioNanos);
    }

    private void start(AudioBuffer buffer) {
        if (firstAudioNanos < 0) {
            firstAudioNanos = System.nanoTime();
        }
        playing = buffer;
        unitsPlayed++;
        try {
            playback = device.play(buffer);
        } catch (RuntimeException e) {
            LOG.warn("Playback of unit {} failed to start: {}", buffer.sequenceIndex(), e.toString());
            playback = CompletableFuture.completedFuture(null);
        }
    }

    private void awaitPlaying() {
        if (playing == null) {
            return;
        }
        try {
            if (playback != null) {
                playback.join();
            }
        } catch (CompletionException | CancellationException e) {
            LOG.warn("Playback of unit {} ended with error: {}", playing.sequenceIndex(), e.toString());
        } finally {
            playing.release();
            playing = null;
            playback = null;
        }
    }
}
