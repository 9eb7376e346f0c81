package com.phillippitts.podcastbuddy.service.synthesis;

import com.phillippitts.podcastbuddy.domain.SentenceUnit;
import com.phillippitts.podcastbuddy.exception.SynthesisException;
import com.phillippitts.podcastbuddy.testutil.FakeSynthesisEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SynthesisWorkerTest {

    private FakeSynthesisEngine engine;
    private SynthesisWorker worker;

    @BeforeEach
    void setUp() {
        engine = new FakeSynthesisEngine();
        worker = new SynthesisWorker(engine, new SpeechTextCleaner(500, 200), new SynthesisGuard(5_000, "fake-tts"));
    }

    @AfterEach
    void cleanUp() throws Exception {
        for (Path file : engine.producedFiles) {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void shouldSynthesizeCleanedTextButKeepSourceText() throws Exception {
        SynthesisResult result = worker.synthesize(new SentenceUnit("**Wow**, really?", 3, false));

        assertThat(result.isSuccess()).isTrue();
        assertThat(engine.synthesized).containsExactly("Wow, really?");
        assertThat(result.buffer().sequenceIndex()).isEqualTo(3);
        assertThat(result.buffer().sourceText()).isEqualTo("**Wow**, really?");
        assertThat(Files.readString(result.buffer().wavFile())).isEqualTo("Wow, really?");
    }

    @Test
    void unspeakableTextFailsWithoutTouchingEngine() {
        SynthesisResult result = worker.synthesize(new SentenceUnit("😀", 0, false));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failureReason()).isEqualTo("no speakable text");
        assertThat(engine.synthesized).isEmpty();
        assertThat(engine.initializations()).isZero();
    }

    @Test
    void engineFailureIsReportedNotThrown() {
        engine.failOn("broken");

        SynthesisResult result = worker.synthesize(new SentenceUnit("This is broken.", 1, true));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.unit().sequenceIndex()).isEqualTo(1);
        assertThat(result.failureReason()).startsWith("SynthesisException: scripted failure");
    }

    @Test
    void engineIsNeverEnteredConcurrently() {
        engine.delayMs = 20;
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<SynthesisResult>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                SentenceUnit unit = new SentenceUnit("Sentence " + i + ".", i, false);
                futures.add(CompletableFuture.supplyAsync(() -> worker.synthesize(unit), pool));
            }
            futures.forEach(CompletableFuture::join);
        } finally {
            pool.shutdownNow();
        }

        assertThat(engine.synthesized).hasSize(8);
        assertThat(engine.maxConcurrent()).isEqualTo(1);
    }

    @Test
    void warmUpSharesTheGuardAndDeletesItsAudio() {
        worker.warmUp();

        assertThat(engine.synthesized).containsExactly(SynthesisWorker.WARM_UP_TEXT);
        assertThat(engine.producedFiles.get(0)).doesNotExist();
    }

    @Test
    void warmUpPropagatesEngineFailure() {
        engine.failOn("Warming");

        assertThatThrownBy(worker::warmUp).isInstanceOf(SynthesisException.class);
    }

    @Test
    void healthAndNameComeFromEngine() {
        assertThat(worker.isHealthy()).isTrue();
        assertThat(worker.engineName()).isEqualTo("fake-tts");
        engine.close();
        assertThat(worker.isHealthy()).isFalse();
    }
}
