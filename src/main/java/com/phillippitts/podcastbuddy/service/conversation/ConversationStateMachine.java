package com.phillippitts.podcastbuddy.service.conversation;

import com.phillippitts.podcastbuddy.domain.ChatMessage;
import com.phillippitts.podcastbuddy.domain.ConversationState;
import com.phillippitts.podcastbuddy.domain.TurnContext;
import com.phillippitts.podcastbuddy.service.memory.MemoryStore;
import com.phillippitts.podcastbuddy.service.memory.OpinionExtractor;
import com.phillippitts.podcastbuddy.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe owner of a session's {@link TurnContext}: decides which conversational mode the
 * next response is in and applies memory side-effects.
 *
 * <p><b>Transition rules</b> for {@link #advance(String)}, in priority order:
 * <ol>
 *   <li>turnCount is incremented;</li>
 *   <li>blank input extends the silence streak, any other input resets it;</li>
 *   <li>a streak of {@value #SILENCE_THRESHOLD} forces {@link ConversationState#ASK} and resets
 *       the streak;</li>
 *   <li>otherwise the default cycle applies ({@link ConversationState#next()}).</li>
 * </ol>
 * Non-blank input on a session with a topic is offered to the opinion extractor.
 *
 * <p><b>Thread Safety:</b> All public methods use a {@link ReentrantLock}. Memory calls happen
 * outside the lock and their failures are logged, not propagated.
 *
 * @since 1.0
 */
public final class ConversationStateMachine {

    private static final Logger LOG = LogManager.getLogger(ConversationStateMachine.class);

    /** Consecutive blank inputs that force the host to ask a question. */
    public static final int SILENCE_THRESHOLD = 2;

    private final Lock lock = new ReentrantLock();
    private final TurnContext context;
    private final MemoryStore memory;
    private final OpinionExtractor opinionExtractor;

    public ConversationStateMachine(TurnContext context, MemoryStore memory, OpinionExtractor opinionExtractor) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.memory = Objects.requireNonNull(memory, "memory must not be null");
        this.opinionExtractor = Objects.requireNonNull(opinionExtractor, "opinionExtractor must not be null");
    }

    /**
     * Advances the conversation by one user turn.
     *
     * @param userInput transcribed user input; null or blank means the user stayed silent
     * @return the state the next response is generated in
     */
    public ConversationState advance(String userInput) {
        boolean silent = userInput == null || userInput.isBlank();
        ConversationState previous;
        ConversationState next;
        String topic;

        lock.lock();
        try {
            previous = context.currentState();
            context.setTurnCount(context.turnCount() + 1);
            context.setSilenceStreak(silent ? context.silenceStreak() + 1 : 0);

            if (context.silenceStreak() >= SILENCE_THRESHOLD) {
                next = ConversationState.ASK;
                context.setSilenceStreak(0);
            } else {
                next = previous.next();
            }
            context.setCurrentState(next);
            topic = context.topic();
        } finally {
            lock.unlock();
        }

        LOG.debug("State {} -> {} (silent={})", previous, next, silent);
        if (!silent && topic != null) {
            recordOpinion(topic, userInput);
        }
        return next;
    }

    /**
     * Starts a new topic: state INTRO, counters and history cleared, topic recorded in memory.
     *
     * @param topic topic title
     * @param topicContext optional background material for the prompt (may be null)
     */
    public void setTopic(String topic, String topicContext) {
        Objects.requireNonNull(topic, "topic must not be null");
        lock.lock();
        try {
            context.setTopic(topic, topicContext);
            context.setCurrentState(ConversationState.INTRO);
            context.setTurnCount(0);
            context.setSilenceStreak(0);
            context.clearHistory();
        } finally {
            lock.unlock();
        }
        LOG.info("Topic set: '{}'", LogSanitizer.preview(topic));
        try {
            memory.recordTopic(topic);
        } catch (RuntimeException e) {
            LOG.warn("Failed to record topic in memory: {}", e.toString());
        }
    }

    /**
     * Appends messages to history, dropping the oldest ones beyond the cap.
     */
    public void appendHistory(ChatMessage... messages) {
        lock.lock();
        try {
            for (ChatMessage message : messages) {
                context.appendHistory(message);
            }
        } finally {
            lock.unlock();
        }
    }

    public TurnContext.Snapshot snapshot() {
        lock.lock();
        try {
            return context.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public void restore(TurnContext.Snapshot snapshot) {
        lock.lock();
        try {
            context.restore(snapshot);
        } finally {
            lock.unlock();
        }
    }

    public ConversationState currentState() {
        lock.lock();
        try {
            return context.currentState();
        } finally {
            lock.unlock();
        }
    }

    public int silenceStreak() {
        lock.lock();
        try {
            return context.silenceStreak();
        } finally {
            lock.unlock();
        }
    }

    public int turnCount() {
        lock.lock();
        try {
            return context.turnCount();
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> topic() {
        lock.lock();
        try {
            return Optional.ofNullable(context.topic());
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> topicContext() {
        lock.lock();
        try {
            return Optional.ofNullable(context.topicContext());
        } finally {
            lock.unlock();
        }
    }

    public List<ChatMessage> history() {
        lock.lock();
        try {
            return context.history();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Memory summary for the system prompt; empty when memory is unavailable.
     */
    public String memorySummary() {
        try {
            return memory.contextSummary();
        } catch (RuntimeException e) {
            LOG.warn("Memory summary unavailable: {}", e.toString());
            return "";
        }
    }

    private void recordOpinion(String topic, String userInput) {
        opinionExtractor.extract(userInput).ifPresent(opinion -> {
            try {
                memory.recordOpinion(topic, opinion);
            } catch (RuntimeException e) {
                LOG.warn("Failed to record opinion in memory: {}", e.toString());
            }
        });
    }
}
