package com.phillippitts.podcastbuddy.testutil;

import com.phillippitts.podcastbuddy.exception.SynthesisException;
import com.phillippitts.podcastbuddy.service.synthesis.SynthesisEngine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for SynthesisEngine that writes the text into a real temporary file.
 *
 * <p>Texts containing any of {@link #failOn(String)}'s fragments fail with
 * {@link SynthesisException}. Tracks peak concurrency so tests can assert the engine was never
 * entered twice at once.
 */
public class FakeSynthesisEngine implements SynthesisEngine {

    public final List<String> synthesized = new CopyOnWriteArrayList<>();
    public final List<Path> producedFiles = new CopyOnWriteArrayList<>();
    public volatile boolean healthy = true;
    public volatile long delayMs;

    private final Set<String> failingFragments = new CopyOnWriteArraySet<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger initializations = new AtomicInteger();

    public FakeSynthesisEngine failOn(String fragment) {
        failingFragments.add(fragment);
        return this;
    }

    public int maxConcurrent() {
        return maxInFlight.get();
    }

    public int initializations() {
        return initializations.get();
    }

    @Override
    public void initialize() {
        initializations.incrementAndGet();
    }

    @Override
    public Path synthesizeToWav(String text) {
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            if (delayMs > 0) {
                Thread.sleep(delayMs);
            }
            for (String fragment : failingFragments) {
                if (text.contains(fragment)) {
                    throw new SynthesisException("scripted failure", getEngineName());
                }
            }
            Path wav = Files.createTempFile("fake-tts-", ".wav");
            Files.writeString(wav, text, StandardCharsets.UTF_8);
            synthesized.add(text);
            producedFiles.add(wav);
            return wav;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisException("interrupted", getEngineName(), e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public String getEngineName() {
        return "fake-tts";
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    @Override
    public void close() {
        healthy = false;
    }
}
