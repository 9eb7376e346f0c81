package com.phillippitts.podcastbuddy.service.playback;

import com.phillippitts.podcastbuddy.domain.AudioBuffer;
import com.phillippitts.podcastbuddy.exception.PlaybackException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.Clip;
import javax.sound.sampled.Line;
import javax.sound.sampled.LineEvent;
import java.util.concurrent.CompletableFuture;

/**
 * Plays WAV files through a Java Sound {@link Clip}.
 *
 * <p>Completion is signalled by the clip's {@link LineEvent.Type#STOP} event, so callers wait on
 * the returned future instead of polling the line.
 */
public class JavaSoundPlaybackDevice implements PlaybackDevice {

    private static final Logger LOG = LogManager.getLogger(JavaSoundPlaybackDevice.class);

    @Override
    public CompletableFuture<Void> play(AudioBuffer buffer) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        Clip clip = null;
        try (AudioInputStream ais = AudioSystem.getAudioInputStream(buffer.wavFile().toFile())) {
            clip = AudioSystem.getClip();
            Clip opened = clip;
            opened.addLineListener(event -> {
                if (event.getType() == LineEvent.Type.STOP) {
                    opened.close();
                    done.complete(null);
                }
            });
            opened.open(ais);
            opened.start();
            LOG.debug("Playing unit {} ({} us)", buffer.sequenceIndex(), opened.getMicrosecondLength());
        } catch (Exception e) {
            if (clip != null) {
                clip.close();
            }
            done.completeExceptionally(new PlaybackException("Clip playback failed: " + e.getMessage(), name(), e));
        }
        return done;
    }

    @Override
    public boolean isAvailable() {
        try {
            return AudioSystem.isLineSupported(new Line.Info(Clip.class));
        } catch (RuntimeException e) {
            LOG.debug("Java Sound unavailable: {}", e.toString());
            return false;
        }
    }

    @Override
    public String name() {
        return "javasound";
    }
}
