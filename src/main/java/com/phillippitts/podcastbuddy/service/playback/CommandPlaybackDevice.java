package com.phillippitts.podcastbuddy.service.playback;

import com.phillippitts.podcastbuddy.domain.AudioBuffer;
import com.phillippitts.podcastbuddy.exception.PlaybackException;
import com.phillippitts.podcastbuddy.service.process.ProcessRunner;
import com.phillippitts.podcastbuddy.util.LogSanitizer;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Plays WAV files with an external command-line player (e.g. {@code aplay -q <file>}).
 * The file path is appended as the last argument.
 */
public class CommandPlaybackDevice implements PlaybackDevice {

    private final List<String> command;
    private final Duration timeout;
    private final ProcessRunner processRunner;
    private final Executor executor;

    public CommandPlaybackDevice(List<String> command, Duration timeout, ProcessRunner processRunner,
                                 Executor executor) {
        this.command = List.copyOf(command);
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.processRunner = Objects.requireNonNull(processRunner, "processRunner must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public CompletableFuture<Void> play(AudioBuffer buffer) {
        List<String> full = new ArrayList<>(command);
        full.add(buffer.wavFile().toAbsolutePath().toString());
        return CompletableFuture.runAsync(() -> run(full), executor);
    }

    private void run(List<String> full) {
        try {
            ProcessRunner.Result result = processRunner.run(full, null, timeout);
            if (!result.isSuccess()) {
                throw new PlaybackException("Exit " + result.exitCode() + ": "
                        + LogSanitizer.truncate(result.stderr(), 200), name());
            }
        } catch (IOException e) {
            throw new PlaybackException(e.getMessage(), name(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlaybackException("Interrupted", name(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        return !command.isEmpty();
    }

    @Override
    public String name() {
        return command.isEmpty() ? "command" : "command:" + command.get(0);
    }
}
