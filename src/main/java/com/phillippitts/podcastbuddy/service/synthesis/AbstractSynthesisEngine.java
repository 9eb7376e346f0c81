package com.phillippitts.podcastbuddy.service.synthesis;

import com.phillippitts.podcastbuddy.exception.SynthesisException;
import jakarta.annotation.PreDestroy;

/**
 * Base class for synthesis engines providing idempotent, thread-safe lifecycle management.
 *
 * <p>Template Method: {@link #initialize()} and {@link #close()} guard state on an internal
 * lock and delegate to {@link #doInitialize()} and {@link #doClose()}.
 *
 * <p>Once closed, an engine may be initialized again.
 *
 * @since 1.0
 * @see PiperSynthesisEngine
 */
public abstract class AbstractSynthesisEngine implements SynthesisEngine {

    /**
     * Guards {@link #initialized} and {@link #closed}.
     */
    protected final Object lock = new Object();

    protected boolean initialized = false;

    protected boolean closed = false;

    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            initialized = true;
            closed = false;
        }
    }

    /**
     * Engine-specific initialization, called under the lock.
     *
     * @throws SynthesisException if the engine cannot be made ready
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Engine-specific cleanup, called under the lock. Must not throw.
     */
    protected abstract void doClose();

    /**
     * @throws SynthesisException if the engine is not initialized or is closed
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new SynthesisException(getEngineName() + " engine not initialized or closed",
                        getEngineName());
            }
        }
    }

    /**
     * Wraps a failure with engine context, preserving {@link SynthesisException} instances.
     */
    protected final SynthesisException wrapFailure(Exception exception) {
        if (exception instanceof SynthesisException se) {
            return se;
        }
        return new SynthesisException(getEngineName() + " synthesis failed: " + exception.getMessage(),
                getEngineName(), exception);
    }
}
