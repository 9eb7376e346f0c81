package com.phillippitts.podcastbuddy.domain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Synthesized audio for one {@link SentenceUnit}, backed by a transient WAV file.
 *
 * <p>The file is owned by the buffer: {@link #release()} deletes it. Release is idempotent and
 * safe to call from any thread.
 */
public final class AudioBuffer {

    private static final Logger LOG = LogManager.getLogger(AudioBuffer.class);

    private final int sequenceIndex;
    private final Path wavFile;
    private final String sourceText;
    private final AtomicBoolean released = new AtomicBoolean(false);

    public AudioBuffer(int sequenceIndex, Path wavFile, String sourceText) {
        this.sequenceIndex = sequenceIndex;
        this.wavFile = Objects.requireNonNull(wavFile, "wavFile must not be null");
        this.sourceText = Objects.requireNonNull(sourceText, "sourceText must not be null");
    }

    public int sequenceIndex() {
        return sequenceIndex;
    }

    public Path wavFile() {
        return wavFile;
    }

    public String sourceText() {
        return sourceText;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Deletes the backing file. Subsequent calls are no-ops.
     */
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            Files.deleteIfExists(wavFile);
        } catch (IOException e) {
            LOG.warn("Failed to delete audio file {}: {}", wavFile, e.toString());
        }
    }

    @Override
    public String toString() {
        return "AudioBuffer{seq=" + sequenceIndex + ", file=" + wavFile.getFileName()
                + ", released=" + released.get() + '}';
    }
}
