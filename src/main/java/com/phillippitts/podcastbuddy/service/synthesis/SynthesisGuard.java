package com.phillippitts.podcastbuddy.service.synthesis;

import com.phillippitts.podcastbuddy.exception.SynthesisException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Single-permit mutual-exclusion region around a non-reentrant synthesis engine.
 *
 * <p>Every path that touches the engine, warm-up included, acquires the same guard. Waiting is
 * bounded so a wedged engine surfaces as a {@link SynthesisException} rather than a hang.
 *
 * <pre>{@code
 * guard.acquire();
 * try {
 *     engine.synthesizeToWav(text);
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 *
 * @since 1.0
 */
public final class SynthesisGuard {

    private final Semaphore semaphore = new Semaphore(1, true);
    private final long timeoutMs;
    private final String engineName;

    public SynthesisGuard(long timeoutMs, String engineName) {
        this.timeoutMs = timeoutMs;
        this.engineName = engineName;
    }

    /**
     * @throws SynthesisException if the permit is not available within the timeout or the
     *         thread is interrupted while waiting
     */
    public void acquire() {
        try {
            if (!semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new SynthesisException("engine busy after " + timeoutMs + "ms wait", engineName);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisException("interrupted while waiting for engine", engineName, e);
        }
    }

    public void release() {
        semaphore.release();
    }

    public boolean isBusy() {
        return semaphore.availablePermits() == 0;
    }
}
