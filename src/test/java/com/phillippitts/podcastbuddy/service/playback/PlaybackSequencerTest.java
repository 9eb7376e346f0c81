package com.phillippitts.podcastbuddy.service.playback;

import com.phillippitts.podcastbuddy.domain.AudioBuffer;
import com.phillippitts.podcastbuddy.domain.SentenceUnit;
import com.phillippitts.podcastbuddy.service.playback.event.SentenceDroppedEvent;
import com.phillippitts.podcastbuddy.service.synthesis.SpeechTextCleaner;
import com.phillippitts.podcastbuddy.service.synthesis.SynthesisGuard;
import com.phillippitts.podcastbuddy.service.synthesis.SynthesisWorker;
import com.phillippitts.podcastbuddy.testutil.EventCapturingPublisher;
import com.phillippitts.podcastbuddy.testutil.FakeSynthesisEngine;
import com.phillippitts.podcastbuddy.testutil.RecordingPlaybackDevice;
import com.phillippitts.podcastbuddy.testutil.RecordingPlaybackDevice.Played;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class PlaybackSequencerTest {

    private FakeSynthesisEngine engine;
    private RecordingPlaybackDevice device;
    private EventCapturingPublisher publisher;
    private AtomicBoolean cancelled;
    private PlaybackSequencer sequencer;

    @BeforeEach
    void setUp() {
        engine = new FakeSynthesisEngine();
        device = new RecordingPlaybackDevice("recording", 30);
        publisher = new EventCapturingPublisher();
        cancelled = new AtomicBoolean();
        SynthesisWorker worker = new SynthesisWorker(engine, new SpeechTextCleaner(500, 200),
                new SynthesisGuard(5_000, "fake-tts"));
        sequencer = new PlaybackSequencer(worker, device, publisher, cancelled::get, "turn-1");
    }

    private static SentenceUnit unit(int index, String text) {
        return new SentenceUnit(text, index, false);
    }

    @Test
    void shouldPlayUnitsInOrderWithoutOverlap() {
        sequencer.admit(unit(0, "One."));
        sequencer.admit(unit(1, "Two."));
        sequencer.admit(unit(2, "Three."));
        sequencer.finish();

        assertThat(device.playedTexts()).containsExactly("One.", "Two.", "Three.");
        assertThat(device.maxConcurrentPlaybacks()).isEqualTo(1);
        List<Played> played = device.played;
        for (int i = 1; i < played.size(); i++) {
            assertThat(played.get(i).startNanos()).isGreaterThanOrEqualTo(played.get(i - 1).endNanos());
        }
        assertThat(sequencer.unitsPlayed()).isEqualTo(3);
        assertThat(sequencer.firstAudioNanos()).isPresent();
    }

    @Test
    void failedSynthesisDropsOnlyThatUnit() {
        engine.failOn("Two");

        sequencer.admit(unit(0, "One."));
        sequencer.admit(unit(1, "Two."));
        sequencer.admit(unit(2, "Three."));
        sequencer.finish();

        assertThat(device.playedTexts()).containsExactly("One.", "Three.");
        assertThat(sequencer.unitsDropped()).isEqualTo(1);
        List<SentenceDroppedEvent> dropped = publisher.eventsOfType(SentenceDroppedEvent.class);
        assertThat(dropped).hasSize(1);
        assertThat(dropped.get(0).sequenceIndex()).isEqualTo(1);
        assertThat(dropped.get(0).turnId()).isEqualTo("turn-1");
    }

    @Test
    void everyBufferIsReleasedAfterPlaying() {
        sequencer.admit(unit(0, "One."));
        sequencer.admit(unit(1, "Two."));
        sequencer.finish();

        assertThat(device.played).allMatch(Played::fileExisted);
        assertThat(device.buffers).allMatch(AudioBuffer::isReleased);
        assertThat(engine.producedFiles).noneMatch(p -> p.toFile().exists());
    }

    @Test
    void nextUnitIsSynthesizedWhilePreviousPlays() throws Exception {
        device.holdPlayback();
        sequencer.admit(unit(0, "One."));
        assertThat(device.awaitFirstPlayback(2_000)).isTrue();

        CompletableFuture<Void> second = CompletableFuture.runAsync(() -> sequencer.admit(unit(1, "Two.")));
        await().atMost(2, TimeUnit.SECONDS).until(() -> engine.synthesized.size() == 2);

        assertThat(engine.synthesized).containsExactly("One.", "Two.");
        assertThat(second).isNotDone();

        device.releasePlayback();
        second.get(5, TimeUnit.SECONDS);
        sequencer.finish();
        assertThat(device.playedTexts()).containsExactly("One.", "Two.");
    }

    @Test
    void cancellationLetsPlayingUnitFinishAndPlaysNothingAfter() throws Exception {
        device.holdPlayback();
        sequencer.admit(unit(0, "One."));
        assertThat(device.awaitFirstPlayback(2_000)).isTrue();

        CompletableFuture<Void> second = CompletableFuture.runAsync(() -> sequencer.admit(unit(1, "Two.")));
        await().atMost(2, TimeUnit.SECONDS).until(() -> engine.synthesized.size() == 2);
        cancelled.set(true);
        device.releasePlayback();
        second.get(5, TimeUnit.SECONDS);
        sequencer.admit(unit(2, "Three."));
        sequencer.abandon();

        assertThat(device.playedTexts()).containsExactly("One.");
        assertThat(engine.synthesized).doesNotContain("Three.");
        for (Path file : engine.producedFiles) {
            assertThat(file).doesNotExist();
        }
    }

    @Test
    void outOfOrderAdmitIsRejected() {
        sequencer.admit(unit(1, "One."));

        assertThatThrownBy(() -> sequencer.admit(unit(1, "Again.")))
                .isInstanceOf(IllegalArgumentException.class);
        sequencer.finish();
    }

    @Test
    void admitAfterFinishIsRejected() {
        sequencer.finish();

        assertThatThrownBy(() -> sequencer.admit(unit(0, "Late.")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failedPlaybackStillReleasesBufferAndContinues() {
        device.failing = true;

        sequencer.admit(unit(0, "One."));
        sequencer.admit(unit(1, "Two."));
        sequencer.finish();

        assertThat(engine.producedFiles).hasSize(2);
        assertThat(engine.producedFiles).noneMatch(p -> p.toFile().exists());
    }
}
