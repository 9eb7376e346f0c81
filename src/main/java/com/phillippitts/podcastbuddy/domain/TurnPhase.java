package com.phillippitts.podcastbuddy.domain;

/**
 * Lifecycle of one conversational turn.
 *
 * <pre>
 * IDLE → AWAITING_MODEL → STREAMING → DRAINING → COMPLETE
 * any non-terminal → CANCELLED
 * AWAITING_MODEL | STREAMING → FAILED
 * </pre>
 */
public enum TurnPhase {
    IDLE,
    AWAITING_MODEL,
    STREAMING,
    DRAINING,
    COMPLETE,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == CANCELLED || this == FAILED;
    }
}
