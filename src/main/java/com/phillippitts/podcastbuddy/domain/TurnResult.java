package com.phillippitts.podcastbuddy.domain;

/**
 * Outcome of a completed, cancelled or failed turn.
 *
 * @param turnId correlation id of the turn (also logged as {@code turnId})
 * @param phase terminal phase reached
 * @param reply text that was spoken (the model reply, or the apology for a failed turn)
 * @param state conversation state after the turn
 * @param turnCount turn counter after the turn
 * @param unitsPlayed number of sentence units handed to playback
 * @param unitsDropped number of sentence units dropped after synthesis failure
 * @param failureReason short reason for FAILED turns, null otherwise
 */
public record TurnResult(
        String turnId,
        TurnPhase phase,
        String reply,
        ConversationState state,
        int turnCount,
        int unitsPlayed,
        int unitsDropped,
        String failureReason
) {

    public boolean isComplete() {
        return phase == TurnPhase.COMPLETE;
    }
}
