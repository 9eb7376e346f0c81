package com.phillippitts.podcastbuddy.service.synthesis;

import com.phillippitts.podcastbuddy.domain.AudioBuffer;
import com.phillippitts.podcastbuddy.domain.SentenceUnit;
import com.phillippitts.podcastbuddy.util.LogSanitizer;
import com.phillippitts.podcastbuddy.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Turns {@link SentenceUnit}s into {@link AudioBuffer}s through a single shared
 * {@link SynthesisEngine}.
 *
 * <p>All engine access, including {@link #warmUp()}, runs inside one {@link SynthesisGuard}, so
 * at most one synthesis is in progress process-wide. {@link #synthesize(SentenceUnit)} never
 * throws: engine errors, lock timeouts and text that cleans down to nothing are reported as a
 * failed {@link SynthesisResult}.
 */
public class SynthesisWorker {

    private static final Logger LOG = LogManager.getLogger(SynthesisWorker.class);

    static final String WARM_UP_TEXT = "Warming up.";

    private final SynthesisEngine engine;
    private final SpeechTextCleaner cleaner;
    private final SynthesisGuard guard;

    public SynthesisWorker(SynthesisEngine engine, SpeechTextCleaner cleaner, SynthesisGuard guard) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.cleaner = Objects.requireNonNull(cleaner, "cleaner must not be null");
        this.guard = Objects.requireNonNull(guard, "guard must not be null");
    }

    public SynthesisResult synthesize(SentenceUnit unit) {
        Objects.requireNonNull(unit, "unit must not be null");
        String text = cleaner.clean(unit.text());
        if (text.isEmpty()) {
            LOG.debug("Unit {} has no speakable text after cleanup", unit.sequenceIndex());
            return SynthesisResult.failure(unit, "no speakable text");
        }

        long start = System.nanoTime();
        try {
            guard.acquire();
            try {
                engine.initialize();
                Path wav = engine.synthesizeToWav(text);
                LOG.debug("Unit {} synthesized in {}ms", unit.sequenceIndex(), TimeUtils.elapsedMillis(start));
                return SynthesisResult.success(unit, new AudioBuffer(unit.sequenceIndex(), wav, unit.text()));
            } finally {
                guard.release();
            }
        } catch (RuntimeException e) {
            LOG.warn("Synthesis failed for unit {} ('{}'): {}", unit.sequenceIndex(),
                    LogSanitizer.preview(unit.text()), e.getMessage());
            return SynthesisResult.failure(unit, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Initializes the engine and renders a short phrase so the first real sentence does not pay
     * the model load cost. Shares the guard with {@link #synthesize(SentenceUnit)}.
     *
     * @throws com.phillippitts.podcastbuddy.exception.SynthesisException if the engine fails
     */
    public void warmUp() {
        long start = System.nanoTime();
        guard.acquire();
        try {
            engine.initialize();
            Path wav = engine.synthesizeToWav(WARM_UP_TEXT);
            try {
                Files.deleteIfExists(wav);
            } catch (IOException e) {
                LOG.debug("Could not delete warm-up audio {}: {}", wav, e.toString());
            }
        } finally {
            guard.release();
        }
        LOG.info("Synthesis engine '{}' warmed up in {}ms", engine.getEngineName(), TimeUtils.elapsedMillis(start));
    }

    public boolean isHealthy() {
        return engine.isHealthy();
    }

    public String engineName() {
        return engine.getEngineName();
    }
}
