package com.phillippitts.podcastbuddy.service.orchestration;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admits at most one turn per session at a time.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → ACTIVE (via tryEnter)
 * ACTIVE → IDLE (via exit)
 * </pre>
 *
 * <p><b>Thread Safety:</b> All public methods are thread-safe and use a {@link ReentrantLock};
 * {@link #awaitIdle(long)} waits on a {@link Condition} signalled by {@link #exit(String)}.
 *
 * @since 1.0
 */
public final class TurnGate {

    private final Lock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();
    private String activeTurn;

    /**
     * @return {@code true} if the turn was admitted, {@code false} if another turn is active
     */
    public boolean tryEnter(String turnId) {
        Objects.requireNonNull(turnId, "turnId must not be null");
        lock.lock();
        try {
            if (activeTurn != null) {
                return false;
            }
            activeTurn = turnId;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Leaves the gate if {@code turnId} is the active turn.
     *
     * @return {@code false} if no turn or a different turn was active
     */
    public boolean exit(String turnId) {
        lock.lock();
        try {
            if (activeTurn == null || !activeTurn.equals(turnId)) {
                return false;
            }
            activeTurn = null;
            idle.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the active turn id, or {@code null} if idle
     */
    public String activeTurn() {
        lock.lock();
        try {
            return activeTurn;
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive() {
        return activeTurn() != null;
    }

    /**
     * Blocks until no turn is active.
     *
     * @param timeoutMs maximum wait in milliseconds
     * @return {@code true} if idle, {@code false} on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitIdle(long timeoutMs) throws InterruptedException {
        long remaining = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        lock.lock();
        try {
            while (activeTurn != null) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
