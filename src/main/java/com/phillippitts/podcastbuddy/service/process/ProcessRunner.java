package com.phillippitts.podcastbuddy.service.process;

import com.phillippitts.podcastbuddy.util.ProcessTimeouts;
import com.phillippitts.podcastbuddy.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs a short-lived external command to completion.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>start the process via {@link ProcessFactory}</li>
 *   <li>optionally write text to stdin, then close it</li>
 *   <li>capture stdout and stderr concurrently, each capped at {@value #OUTPUT_MAX_CHARS} chars</li>
 *   <li>enforce a timeout and terminate runaway processes (destroy, then destroyForcibly)</li>
 * </ul>
 *
 * <p>A non-zero exit code is not an error here; callers inspect {@link Result#exitCode()}.
 *
 * <p><b>Thread Safety:</b> Stateless apart from the factory; safe for concurrent use.
 */
public final class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    static final int OUTPUT_MAX_CHARS = 8192;

    private final ProcessFactory processFactory;

    public ProcessRunner() {
        this(new DefaultProcessFactory());
    }

    public ProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory must not be null");
    }

    /**
     * Outcome of a process that terminated within its timeout.
     */
    public record Result(int exitCode, String stdout, String stderr, long durationMs) {
        public boolean isSuccess() {
            return exitCode == 0;
        }
    }

    /**
     * Runs {@code command}, feeding {@code stdin} (if non-null) as UTF-8 text.
     *
     * @throws IOException if the process cannot be started, stdin cannot be written, or it does
     *         not terminate within {@code timeout}
     * @throws InterruptedException if interrupted while waiting; the process is terminated
     */
    public Result run(List<String> command, String stdin, Duration timeout) throws IOException, InterruptedException {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        long start = System.nanoTime();

        Process process = processFactory.start(command, null);
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        // Start gobblers before writing or waiting to avoid pipe deadlock
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, "proc-out");
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, "proc-err");

        try {
            writeStdin(process, stdin);
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(process);
                throw new IOException("Timeout after " + timeout.toSeconds() + "s: " + command.get(0));
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            return new Result(process.exitValue(), snapshot(stdout), snapshot(stderr),
                    TimeUtils.elapsedMillis(start));
        } catch (InterruptedException e) {
            destroyProcess(process);
            throw e;
        } catch (IOException e) {
            if (process.isAlive()) {
                destroyProcess(process);
            }
            throw e;
        }
    }

    private static void writeStdin(Process process, String stdin) throws IOException {
        try (OutputStream os = process.getOutputStream()) {
            if (stdin != null) {
                os.write(stdin.getBytes(StandardCharsets.UTF_8));
                os.write('\n');
            }
        }
    }

    private static String snapshot(StringBuilder sb) {
        synchronized (sb) {
            return sb.toString();
        }
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name) {
        Thread thread = new Thread(() -> gobble(inputStream, sink, name), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void gobble(InputStream inputStream, StringBuilder sink, String name) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                synchronized (sink) {
                    // Keep draining once capped so the child never blocks on a full pipe
                    if (sink.length() >= OUTPUT_MAX_CHARS) {
                        continue;
                    }
                    if (!sink.isEmpty()) {
                        sink.append('\n');
                    }
                    sink.append(line, 0, Math.min(line.length(), OUTPUT_MAX_CHARS - sink.length()));
                }
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }
}
