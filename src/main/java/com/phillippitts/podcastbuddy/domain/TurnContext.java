package com.phillippitts.podcastbuddy.domain;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Mutable conversational context owned by a single session.
 *
 * <p>History is capped at {@code maxHistory} messages; the oldest messages are dropped first.
 *
 * <p><b>Thread Safety:</b> Not thread-safe. Callers serialize access (see
 * {@code ConversationStateMachine}).
 */
public final class TurnContext {

    private final int maxHistory;
    private final Deque<ChatMessage> history = new ArrayDeque<>();

    private ConversationState currentState = ConversationState.INTRO;
    private String topic;
    private String topicContext;
    private int silenceStreak;
    private int turnCount;

    public TurnContext(int maxHistory) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be >= 1");
        }
        this.maxHistory = maxHistory;
    }

    /**
     * Captures the fields a failed turn must leave unchanged.
     */
    public record Snapshot(ConversationState state, int silenceStreak, int turnCount) { }

    public Snapshot snapshot() {
        return new Snapshot(currentState, silenceStreak, turnCount);
    }

    public void restore(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        this.currentState = snapshot.state();
        this.silenceStreak = snapshot.silenceStreak();
        this.turnCount = snapshot.turnCount();
    }

    public void appendHistory(ChatMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        history.addLast(message);
        while (history.size() > maxHistory) {
            history.removeFirst();
        }
    }

    public List<ChatMessage> history() {
        return List.copyOf(history);
    }

    public void clearHistory() {
        history.clear();
    }

    public int maxHistory() {
        return maxHistory;
    }

    public ConversationState currentState() {
        return currentState;
    }

    public void setCurrentState(ConversationState currentState) {
        this.currentState = Objects.requireNonNull(currentState, "currentState must not be null");
    }

    public String topic() {
        return topic;
    }

    public String topicContext() {
        return topicContext;
    }

    public void setTopic(String topic, String topicContext) {
        this.topic = topic;
        this.topicContext = topicContext;
    }

    public int silenceStreak() {
        return silenceStreak;
    }

    public void setSilenceStreak(int silenceStreak) {
        if (silenceStreak < 0) {
            throw new IllegalArgumentException("silenceStreak must be >= 0");
        }
        this.silenceStreak = silenceStreak;
    }

    public int turnCount() {
        return turnCount;
    }

    public void setTurnCount(int turnCount) {
        if (turnCount < 0) {
            throw new IllegalArgumentException("turnCount must be >= 0");
        }
        this.turnCount = turnCount;
    }
}
