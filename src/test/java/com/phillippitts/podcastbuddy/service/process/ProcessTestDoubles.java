package com.phillippitts.podcastbuddy.service.process;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Shared test doubles for process-based adapters.
 * Provides fake Process implementations so tests never spawn a real binary.
 */
public final class ProcessTestDoubles {

    private ProcessTestDoubles() {}

    /**
     * Encapsulates test process behavior configuration.
     *
     * @param stdout stdout content to return
     * @param stderr stderr content to return
     * @param exitCode process exit code
     * @param finishAfterMillis delay before process finishes (-1 means never finish)
     */
    public record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis) {

        public static ProcessBehavior succeeding() {
            return new ProcessBehavior("", "", 0, 0);
        }
    }

    /**
     * Side effect run when a command starts, e.g. writing the file a real binary would produce.
     */
    @FunctionalInterface
    public interface OnStart {
        void accept(List<String> command) throws IOException;
    }

    /**
     * Stub ProcessFactory that records every command and returns a fresh {@link TestProcess}.
     */
    public static final class StubProcessFactory implements ProcessFactory {
        private final ProcessBehavior behavior;
        private final OnStart onStart;
        public final List<List<String>> commands = new CopyOnWriteArrayList<>();
        public final List<TestProcess> processes = new CopyOnWriteArrayList<>();

        public StubProcessFactory(ProcessBehavior behavior) {
            this(behavior, command -> { });
        }

        public StubProcessFactory(ProcessBehavior behavior, OnStart onStart) {
            this.behavior = behavior;
            this.onStart = onStart;
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            commands.add(List.copyOf(command));
            onStart.accept(command);
            TestProcess process = new TestProcess(behavior);
            processes.add(process);
            return process;
        }

        public TestProcess lastProcess() {
            return processes.get(processes.size() - 1);
        }
    }

    /**
     * Minimal fake Process that allows controlling stdout/stderr, exit code, and termination timing.
     * Captures whatever is written to stdin.
     */
    public static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final long finishAfterMillis;
        private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
        private volatile boolean alive = true;
        private volatile boolean destroyCalled = false;

        TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            this.finishAfterMillis = behavior.finishAfterMillis();
            if (finishAfterMillis == 0) {
                this.alive = false;
            }
        }

        public boolean wasDestroyCalled() {
            return destroyCalled;
        }

        public String stdinText() {
            return stdin.toString(StandardCharsets.UTF_8);
        }

        @Override
        public OutputStream getOutputStream() {
            return stdin;
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() {
            this.alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            long ms = unit.toMillis(timeout);
            if (finishAfterMillis < 0 || finishAfterMillis > ms) {
                Thread.sleep(ms);
                return !alive;
            }
            Thread.sleep(finishAfterMillis);
            this.alive = false;
            return true;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroyCalled = true;
            alive = false;
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
