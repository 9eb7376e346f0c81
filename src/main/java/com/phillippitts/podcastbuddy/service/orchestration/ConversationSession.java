package com.phillippitts.podcastbuddy.service.orchestration;

import com.phillippitts.podcastbuddy.domain.ChatMessage;
import com.phillippitts.podcastbuddy.domain.ConversationState;
import com.phillippitts.podcastbuddy.domain.TurnResult;
import com.phillippitts.podcastbuddy.service.conversation.ConversationStateMachine;
import com.phillippitts.podcastbuddy.service.conversation.StopPhraseDetector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One listener's conversation: topic start, user utterances, stop phrases and disconnect.
 *
 * <p>Every entry point tags the calling thread's ThreadContext with {@code sessionId} for the
 * duration of the call.
 *
 * <p><b>Thread Safety:</b> Turns are serialized by the underlying {@link TurnOrchestrator};
 * {@link #detach()} and {@link #cancelTurn()} may be called from any thread.
 */
public class ConversationSession {

    private static final Logger LOG = LogManager.getLogger(ConversationSession.class);

    static final Duration IDLE_WAIT = Duration.ofSeconds(30);

    private final String sessionId;
    private final ConversationStateMachine stateMachine;
    private final TurnOrchestrator orchestrator;
    private final StopPhraseDetector stopPhrases;
    private volatile boolean ended;

    public ConversationSession(String sessionId,
                               ConversationStateMachine stateMachine,
                               TurnOrchestrator orchestrator,
                               StopPhraseDetector stopPhrases) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.stopPhrases = Objects.requireNonNull(stopPhrases, "stopPhrases must not be null");
    }

    /**
     * Sets the topic (state INTRO, history cleared) and speaks the intro. A turn still in flight
     * is cancelled first.
     *
     * @throws IllegalStateException if the session has ended
     */
    public TurnResult startTopic(String topic, String topicContext) {
        ensureOpen();
        ThreadContext.put("sessionId", sessionId);
        try {
            interruptActiveTurn();
            stateMachine.setTopic(topic, topicContext);
            return orchestrator.runIntroTurn();
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    /**
     * Handles one transcribed utterance. A stop phrase cancels the active turn, speaks the
     * farewell and ends the session; anything else runs a normal turn.
     *
     * @param input transcribed text; blank means silence
     * @throws IllegalStateException if the session has ended
     * @throws com.phillippitts.podcastbuddy.exception.TurnRejectedException if a turn is in flight
     */
    public TurnResult handleUserInput(String input) {
        ensureOpen();
        ThreadContext.put("sessionId", sessionId);
        try {
            if (stopPhrases.isStopPhrase(input)) {
                LOG.info("Stop phrase received; ending session");
                interruptActiveTurn();
                ended = true;
                return orchestrator.runFarewellTurn();
            }
            return orchestrator.runTurn(input);
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    /**
     * @return {@code true} if a turn was in flight and has been asked to stop
     */
    public boolean cancelTurn() {
        return orchestrator.cancelActiveTurn();
    }

    /**
     * Ends the session without a farewell, e.g. when the listener's connection goes away.
     */
    public void detach() {
        if (ended) {
            return;
        }
        ended = true;
        if (orchestrator.cancelActiveTurn()) {
            LOG.info("Session {} detached; active turn cancelled", sessionId);
        } else {
            LOG.info("Session {} detached", sessionId);
        }
    }

    /**
     * Blocks until no turn is in flight.
     */
    public boolean awaitIdle(Duration timeout) {
        return orchestrator.awaitIdle(timeout);
    }

    public boolean isEnded() {
        return ended;
    }

    public String sessionId() {
        return sessionId;
    }

    public ConversationState currentState() {
        return stateMachine.currentState();
    }

    public Optional<String> topic() {
        return stateMachine.topic();
    }

    public List<ChatMessage> history() {
        return stateMachine.history();
    }

    private void interruptActiveTurn() {
        if (orchestrator.cancelActiveTurn() && !orchestrator.awaitIdle(IDLE_WAIT)) {
            LOG.warn("Active turn did not stop within {}s", IDLE_WAIT.toSeconds());
        }
    }

    private void ensureOpen() {
        if (ended) {
            throw new IllegalStateException("Session " + sessionId + " has ended");
        }
    }
}
