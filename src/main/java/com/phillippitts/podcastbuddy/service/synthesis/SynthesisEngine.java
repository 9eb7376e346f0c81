package com.phillippitts.podcastbuddy.service.synthesis;

import com.phillippitts.podcastbuddy.exception.SynthesisException;

import java.nio.file.Path;

/**
 * Contract for text-to-speech engines.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Engine is constructed with configuration (binary, voice model)</li>
 *   <li>{@link #initialize()} validates and loads resources (may throw {@link SynthesisException})</li>
 *   <li>{@link #synthesizeToWav(String)} renders text to a new WAV file</li>
 *   <li>{@link #close()} releases resources when the engine is no longer needed</li>
 * </ol>
 *
 * <p><b>Thread Safety:</b> Engines are NOT required to be reentrant. Callers must serialize
 * {@link #synthesizeToWav(String)}; {@link SynthesisWorker} does so for the application.
 */
public interface SynthesisEngine extends AutoCloseable {

    void initialize();

    /**
     * Renders text to a new temporary WAV file owned by the caller.
     *
     * @param text cleaned, non-blank text
     * @return path to the WAV file
     * @throws SynthesisException if the engine fails
     */
    Path synthesizeToWav(String text);

    /**
     * @return engine name (e.g. "piper")
     */
    String getEngineName();

    boolean isHealthy();

    @Override
    void close();
}
