package com.phillippitts.podcastbuddy.service.synthesis;

import com.phillippitts.podcastbuddy.config.properties.SynthesisProperties;
import com.phillippitts.podcastbuddy.exception.SynthesisException;
import com.phillippitts.podcastbuddy.service.process.ProcessRunner;
import com.phillippitts.podcastbuddy.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Synthesis engine backed by the Piper command-line tool.
 *
 * <p>CLI contract (text on stdin):
 * <pre>
 * ${binary} --model ${model} --output_file ${wav}
 * </pre>
 *
 * <p>Each call writes a fresh temporary WAV file; ownership passes to the caller.
 */
public class PiperSynthesisEngine extends AbstractSynthesisEngine {

    private static final Logger LOG = LogManager.getLogger(PiperSynthesisEngine.class);

    static final String ENGINE_NAME = "piper";
    static final int STDERR_SNIPPET_CHARS = 300;

    private final SynthesisProperties properties;
    private final ProcessRunner processRunner;

    public PiperSynthesisEngine(SynthesisProperties properties, ProcessRunner processRunner) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.processRunner = Objects.requireNonNull(processRunner, "processRunner must not be null");
    }

    @Override
    protected void doInitialize() {
        Path model = Path.of(properties.getModelPath());
        if (!Files.isRegularFile(model)) {
            throw new SynthesisException("Voice model not found: " + model.toAbsolutePath(), ENGINE_NAME);
        }
        LOG.info("Piper engine ready (binary={}, model={})", properties.getBinaryPath(), model.getFileName());
    }

    @Override
    protected void doClose() {
        LOG.debug("Piper engine closed");
    }

    @Override
    public Path synthesizeToWav(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        ensureInitialized();

        Path wav = null;
        try {
            wav = Files.createTempFile("podcast-buddy-", ".wav");
            List<String> command = List.of(
                    properties.getBinaryPath(),
                    "--model", properties.getModelPath(),
                    "--output_file", wav.toAbsolutePath().toString());
            ProcessRunner.Result result = processRunner.run(command, text,
                    Duration.ofSeconds(properties.getTimeoutSeconds()));
            if (!result.isSuccess()) {
                throw new SynthesisException("Non-zero exit: " + result.exitCode() + " stderr="
                        + LogSanitizer.truncate(result.stderr(), STDERR_SNIPPET_CHARS), ENGINE_NAME);
            }
            if (Files.size(wav) == 0) {
                throw new SynthesisException("Piper produced no audio output", ENGINE_NAME);
            }
            LOG.debug("Synthesized {} chars in {}ms", text.length(), result.durationMs());
            return wav;
        } catch (IOException | RuntimeException e) {
            deleteQuietly(wav);
            throw wrapFailure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deleteQuietly(wav);
            throw new SynthesisException("Interrupted during synthesis", ENGINE_NAME, e);
        }
    }

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debug("Could not delete {}: {}", path, e.toString());
        }
    }
}
