package com.phillippitts.podcastbuddy.service.orchestration;

import com.phillippitts.podcastbuddy.config.properties.ConversationProperties;
import com.phillippitts.podcastbuddy.domain.ChatMessage;
import com.phillippitts.podcastbuddy.domain.ConversationState;
import com.phillippitts.podcastbuddy.domain.SentenceUnit;
import com.phillippitts.podcastbuddy.domain.TurnContext;
import com.phillippitts.podcastbuddy.domain.TurnPhase;
import com.phillippitts.podcastbuddy.domain.TurnResult;
import com.phillippitts.podcastbuddy.exception.ModelTimeoutException;
import com.phillippitts.podcastbuddy.exception.ModelUnavailableException;
import com.phillippitts.podcastbuddy.exception.TurnRejectedException;
import com.phillippitts.podcastbuddy.service.conversation.ConversationStateMachine;
import com.phillippitts.podcastbuddy.service.conversation.PromptAssembler;
import com.phillippitts.podcastbuddy.service.llm.LlmClient;
import com.phillippitts.podcastbuddy.service.orchestration.event.TurnCompletedEvent;
import com.phillippitts.podcastbuddy.service.playback.PlaybackDevice;
import com.phillippitts.podcastbuddy.service.playback.PlaybackSequencer;
import com.phillippitts.podcastbuddy.service.segment.SentenceSegmenter;
import com.phillippitts.podcastbuddy.service.synthesis.SynthesisWorker;
import com.phillippitts.podcastbuddy.util.LogSanitizer;
import com.phillippitts.podcastbuddy.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Runs one conversational turn end to end: state advance, prompt, streamed model reply,
 * sentence segmentation, synthesis and ordered playback.
 *
 * <p><b>Phases:</b>
 * <pre>
 * IDLE → AWAITING_MODEL → STREAMING → DRAINING → COMPLETE
 *                 └──────────┴──→ FAILED      (model unreachable / timed out before any text)
 * any non-terminal phase ──────→ CANCELLED    (cancelActiveTurn)
 * </pre>
 *
 * <p><b>Threads:</b> the calling thread drives the turn. A reader task on the LLM executor pulls
 * fragments from the model stream into a queue; the turn thread waits on that queue with the
 * model timeout, feeds the segmenter and admits units to a {@link PlaybackSequencer}. While the
 * turn thread is synthesizing unit i+1 the device plays unit i.
 *
 * <p><b>Failure policy:</b>
 * <ul>
 *   <li>no text before the timeout or a stream error: FAILED, state fields rolled back, a canned
 *       apology (one per cause) is spoken and returned as the reply</li>
 *   <li>timeout or stream error after some text: treated as end of stream, what arrived is
 *       spoken</li>
 *   <li>cancel: the unit already playing finishes, nothing further is synthesized or played,
 *       history is left untouched</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> One orchestrator per session. Turns are serialized by a
 * {@link TurnGate}; a concurrent request fails with {@link TurnRejectedException}.
 * {@link #cancelActiveTurn()} may be called from any thread.
 */
public class TurnOrchestrator {

    private static final Logger LOG = LogManager.getLogger(TurnOrchestrator.class);

    enum TurnKind {
        USER, INTRO, FAREWELL;

        String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    enum FailureCause {
        MODEL_UNAVAILABLE, MODEL_TIMEOUT, STREAM_ERROR, UNEXPECTED;

        String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final String sessionId;
    private final ConversationStateMachine stateMachine;
    private final PromptAssembler promptAssembler;
    private final LlmClient llmClient;
    private final SynthesisWorker synthesisWorker;
    private final PlaybackDevice playbackDevice;
    private final Executor llmExecutor;
    private final ApplicationEventPublisher publisher;
    private final TurnMetricsPublisher metrics;
    private final ConversationProperties conversation;
    private final long modelTimeoutMs;
    private final int sentencesPerUnit;
    private final TurnGate gate = new TurnGate();
    // Guards gate admission/exit together with publishing and reading active
    private final Object admission = new Object();

    private volatile ActiveTurn active;

    private TurnOrchestrator(Builder b) {
        this.sessionId = b.sessionId;
        this.stateMachine = Objects.requireNonNull(b.stateMachine, "stateMachine must not be null");
        this.promptAssembler = Objects.requireNonNull(b.promptAssembler, "promptAssembler must not be null");
        this.llmClient = Objects.requireNonNull(b.llmClient, "llmClient must not be null");
        this.synthesisWorker = Objects.requireNonNull(b.synthesisWorker, "synthesisWorker must not be null");
        this.playbackDevice = Objects.requireNonNull(b.playbackDevice, "playbackDevice must not be null");
        this.llmExecutor = Objects.requireNonNull(b.llmExecutor, "llmExecutor must not be null");
        this.publisher = Objects.requireNonNull(b.publisher, "publisher must not be null");
        this.metrics = b.metrics == null ? TurnMetricsPublisher.NOOP : b.metrics;
        this.conversation = Objects.requireNonNull(b.conversation, "conversation must not be null");
        if (b.modelTimeoutMs < 1) {
            throw new IllegalArgumentException("modelTimeoutMs must be >= 1");
        }
        this.modelTimeoutMs = b.modelTimeoutMs;
        this.sentencesPerUnit = b.sentencesPerUnit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs a turn for the user's utterance.
     *
     * @param userInput transcribed input; blank means the user stayed silent
     * @return outcome of the turn
     * @throws TurnRejectedException if another turn of this session is in flight
     */
    public TurnResult runTurn(String userInput) {
        return execute(TurnKind.USER, userInput == null ? "" : userInput);
    }

    /**
     * Opens the topic: speaks the intro in state INTRO, then advances the conversation.
     *
     * @throws TurnRejectedException if another turn of this session is in flight
     */
    public TurnResult runIntroTurn() {
        return execute(TurnKind.INTRO, null);
    }

    /**
     * Speaks a short goodbye. Neither state nor history change.
     *
     * @throws TurnRejectedException if another turn of this session is in flight
     */
    public TurnResult runFarewellTurn() {
        return execute(TurnKind.FAREWELL, null);
    }

    /**
     * Cancels the turn in flight, if any. Returns immediately; the turn thread observes the flag
     * before synthesis, before playback and while waiting for model output.
     *
     * @return {@code true} if a turn was cancelled
     */
    public boolean cancelActiveTurn() {
        ActiveTurn turn;
        synchronized (admission) {
            turn = active;
        }
        if (turn == null) {
            return false;
        }
        if (turn.cancel()) {
            LOG.info("Cancelling turn {}", turn.turnId);
        }
        return true;
    }

    /**
     * Blocks until no turn is in flight.
     *
     * @return {@code true} if idle, {@code false} on timeout or interruption
     */
    public boolean awaitIdle(Duration timeout) {
        try {
            return gate.awaitIdle(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isTurnActive() {
        return gate.isActive();
    }

    /**
     * @return phase of the turn in flight, {@link TurnPhase#IDLE} when none
     */
    public TurnPhase currentPhase() {
        ActiveTurn turn = active;
        return turn == null ? TurnPhase.IDLE : turn.phase;
    }

    private TurnResult execute(TurnKind kind, String userInput) {
        String turnId = UUID.randomUUID().toString().substring(0, 8);
        ActiveTurn turn = new ActiveTurn(turnId);
        synchronized (admission) {
            if (!gate.tryEnter(turnId)) {
                String activeId = gate.activeTurn();
                LOG.warn("Rejecting {} turn: turn {} still in flight", kind.tag(), activeId);
                throw new TurnRejectedException(activeId);
            }
            active = turn;
        }
        ThreadContext.put("turnId", turnId);
        try {
            return runPipeline(kind, userInput, turn);
        } finally {
            turn.closeStream();
            ThreadContext.remove("turnId");
            synchronized (admission) {
                active = null;
                gate.exit(turnId);
            }
        }
    }

    private TurnResult runPipeline(TurnKind kind, String userInput, ActiveTurn turn) {
        long start = System.nanoTime();
        TurnContext.Snapshot snapshot = stateMachine.snapshot();
        PlaybackSequencer sequencer = newSequencer(turn);
        StreamOutcome outcome;
        String userMessage = null;

        try {
            userMessage = prepareUserMessage(kind, userInput);
            ConversationState state = stateMachine.currentState();
            LOG.info("Turn {} started (kind={}, state={}, input='{}')", turn.turnId, kind.tag(), state,
                    LogSanitizer.preview(userInput));
            List<ChatMessage> messages = promptAssembler.assemble(state, stateMachine.memorySummary(),
                    stateMachine.topicContext().orElse(null), stateMachine.history(), userMessage);
            outcome = streamReply(turn, messages, sequencer);
        } catch (RuntimeException e) {
            LOG.error("Turn {} failed unexpectedly: {}", turn.turnId, e.toString(), e);
            sequencer.abandon();
            outcome = StreamOutcome.failed(FailureCause.UNEXPECTED);
        }

        int played = sequencer.unitsPlayed();
        int dropped = sequencer.unitsDropped();
        sequencer.firstAudioNanos().ifPresent(t -> metrics.recordFirstAudio(t - start));
        String reply = outcome.reply();

        if (outcome.phase() == TurnPhase.COMPLETE) {
            recordExchange(kind, userInput, userMessage, reply);
        } else if (outcome.phase() == TurnPhase.FAILED) {
            stateMachine.restore(snapshot);
            reply = apologyFor(outcome.cause());
            PlaybackSequencer apology = newSequencer(turn);
            speak(apology, reply, turn);
            played += apology.unitsPlayed();
            dropped += apology.unitsDropped();
            if (kind == TurnKind.USER) {
                appendUserAndReply(userInput, reply);
            }
        }
        turn.phase = outcome.phase();

        String failureReason = outcome.cause() == null ? null : outcome.cause().tag();
        long durationNanos = System.nanoTime() - start;
        LOG.info("Turn {} {} in {}ms (played={}, dropped={})", turn.turnId, outcome.phase(),
                durationNanos / TimeUtils.NANOS_PER_MILLI, played, dropped);
        metrics.recordTurn(kind.tag(), outcome.phase(), failureReason, durationNanos);
        publisher.publishEvent(new TurnCompletedEvent(sessionId, turn.turnId, kind.tag(), outcome.phase(),
                failureReason, durationNanos / TimeUtils.NANOS_PER_MILLI, played, dropped, Instant.now()));

        return new TurnResult(turn.turnId, outcome.phase(), reply, stateMachine.currentState(),
                stateMachine.turnCount(), played, dropped, failureReason);
    }

    private String prepareUserMessage(TurnKind kind, String userInput) {
        switch (kind) {
            case USER:
                stateMachine.advance(userInput);
                return userInput.isBlank() ? promptAssembler.silencePrompt(stateMachine.turnCount()) : userInput;
            case INTRO:
                return promptAssembler.introPrompt(stateMachine.topic().orElse(null));
            case FAREWELL:
            default:
                return promptAssembler.farewellPrompt();
        }
    }

    private void recordExchange(TurnKind kind, String userInput, String userMessage, String reply) {
        switch (kind) {
            case USER:
                appendUserAndReply(userInput, reply);
                break;
            case INTRO:
                if (!reply.isBlank()) {
                    stateMachine.appendHistory(ChatMessage.user(userMessage), ChatMessage.assistant(reply));
                }
                stateMachine.advance(userMessage);
                break;
            default:
                break;
        }
    }

    private void appendUserAndReply(String userInput, String reply) {
        if (userInput != null && !userInput.isBlank()) {
            stateMachine.appendHistory(ChatMessage.user(userInput));
        }
        if (!reply.isBlank()) {
            stateMachine.appendHistory(ChatMessage.assistant(reply));
        }
    }

    private StreamOutcome streamReply(ActiveTurn turn, List<ChatMessage> messages, PlaybackSequencer sequencer) {
        turn.phase = TurnPhase.AWAITING_MODEL;
        long start = System.nanoTime();
        try {
            llmExecutor.execute(() -> readTokens(turn, messages));
        } catch (RejectedExecutionException e) {
            LOG.error("LLM executor rejected turn {}: {}", turn.turnId, e.toString());
            return StreamOutcome.failed(FailureCause.UNEXPECTED);
        }

        SentenceSegmenter segmenter = new SentenceSegmenter(sentencesPerUnit);
        StringBuilder reply = new StringBuilder();
        try {
            boolean streaming = true;
            while (streaming) {
                Signal signal = turn.signals.poll(modelTimeoutMs, TimeUnit.MILLISECONDS);
                if (turn.isCancelled()) {
                    return cancelled(sequencer, reply);
                }
                if (signal == null) {
                    turn.closeStream();
                    if (reply.length() == 0) {
                        LOG.error("No model output within {}ms", modelTimeoutMs);
                        sequencer.abandon();
                        return StreamOutcome.failed(FailureCause.MODEL_TIMEOUT);
                    }
                    LOG.warn("Model stalled for {}ms mid-reply; speaking the {} chars received",
                            modelTimeoutMs, reply.length());
                    break;
                }
                switch (signal.kind()) {
                    case TOKEN:
                        if (turn.phase == TurnPhase.AWAITING_MODEL) {
                            turn.phase = TurnPhase.STREAMING;
                            LOG.debug("First token after {}ms", TimeUtils.elapsedMillis(start));
                        }
                        reply.append(signal.text());
                        for (SentenceUnit unit : segmenter.accept(signal.text())) {
                            sequencer.admit(unit);
                        }
                        if (turn.isCancelled()) {
                            return cancelled(sequencer, reply);
                        }
                        break;
                    case ERROR:
                        if (reply.length() == 0) {
                            logFailure(signal);
                            sequencer.abandon();
                            return StreamOutcome.failed(signal.cause());
                        }
                        LOG.warn("Model stream broke after {} chars: {}; speaking what arrived",
                                reply.length(), signal.error().toString());
                        streaming = false;
                        break;
                    case END:
                    default:
                        streaming = false;
                        break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            turn.cancel();
            return cancelled(sequencer, reply);
        }

        turn.phase = TurnPhase.DRAINING;
        segmenter.finish().ifPresent(sequencer::admit);
        sequencer.finish();
        if (turn.isCancelled()) {
            return StreamOutcome.cancelled(reply.toString().trim());
        }
        return StreamOutcome.complete(reply.toString().trim());
    }

    private void readTokens(ActiveTurn turn, List<ChatMessage> messages) {
        Stream<String> tokens = openStream(turn, messages);
        if (tokens == null || !turn.attach(tokens)) {
            return;
        }
        try (tokens) {
            Iterator<String> it = tokens.iterator();
            while (it.hasNext()) {
                String fragment = it.next();
                if (turn.isStreamClosed()) {
                    return;
                }
                turn.signals.offer(Signal.token(fragment));
            }
            turn.signals.offer(Signal.END);
        } catch (RuntimeException e) {
            if (turn.isStreamClosed()) {
                LOG.debug("Token stream closed: {}", e.toString());
                return;
            }
            FailureCause cause = e instanceof ModelTimeoutException
                    ? FailureCause.MODEL_TIMEOUT : FailureCause.STREAM_ERROR;
            turn.signals.offer(Signal.error(cause, e));
        }
    }

    private Stream<String> openStream(ActiveTurn turn, List<ChatMessage> messages) {
        try {
            return llmClient.streamChat(messages);
        } catch (ModelTimeoutException e) {
            turn.signals.offer(Signal.error(FailureCause.MODEL_TIMEOUT, e));
        } catch (ModelUnavailableException e) {
            turn.signals.offer(Signal.error(FailureCause.MODEL_UNAVAILABLE, e));
        } catch (RuntimeException e) {
            turn.signals.offer(Signal.error(FailureCause.UNEXPECTED, e));
        }
        return null;
    }

    private StreamOutcome cancelled(PlaybackSequencer sequencer, StringBuilder reply) {
        sequencer.abandon();
        return StreamOutcome.cancelled(reply.toString().trim());
    }

    private void speak(PlaybackSequencer sequencer, String text, ActiveTurn turn) {
        for (SentenceUnit unit : SentenceSegmenter.split(text, sentencesPerUnit)) {
            if (turn.isCancelled()) {
                break;
            }
            sequencer.admit(unit);
        }
        sequencer.finish();
    }

    private PlaybackSequencer newSequencer(ActiveTurn turn) {
        return new PlaybackSequencer(synthesisWorker, playbackDevice, publisher, turn::isCancelled, turn.turnId);
    }

    private String apologyFor(FailureCause cause) {
        switch (cause) {
            case MODEL_UNAVAILABLE:
                return conversation.getUnavailableApology();
            case MODEL_TIMEOUT:
                return conversation.getTimeoutApology();
            case STREAM_ERROR:
                return conversation.getStreamErrorApology();
            case UNEXPECTED:
            default:
                return conversation.getErrorApology();
        }
    }

    private void logFailure(Signal signal) {
        switch (signal.cause()) {
            case MODEL_UNAVAILABLE:
                LOG.error("Cannot reach the language model: {}", signal.error().getMessage());
                break;
            case MODEL_TIMEOUT:
                LOG.error("Language model request timed out: {}", signal.error().getMessage());
                break;
            default:
                LOG.error("Language model stream failed: {}", signal.error().toString());
                break;
        }
    }

    /**
     * Item handed from the reader task to the turn thread.
     */
    private record Signal(Kind kind, String text, FailureCause cause, RuntimeException error) {
        enum Kind { TOKEN, END, ERROR }

        static final Signal END = new Signal(Kind.END, null, null, null);

        static Signal token(String text) {
            return new Signal(Kind.TOKEN, text, null, null);
        }

        static Signal error(FailureCause cause, RuntimeException error) {
            return new Signal(Kind.ERROR, null, cause, error);
        }
    }

    private record StreamOutcome(TurnPhase phase, String reply, FailureCause cause) {
        static StreamOutcome complete(String reply) {
            return new StreamOutcome(TurnPhase.COMPLETE, reply, null);
        }

        static StreamOutcome cancelled(String reply) {
            return new StreamOutcome(TurnPhase.CANCELLED, reply, null);
        }

        static StreamOutcome failed(FailureCause cause) {
            return new StreamOutcome(TurnPhase.FAILED, "", cause);
        }
    }

    /**
     * Per-turn mutable state shared between the turn thread, the reader task and cancellers.
     */
    private static final class ActiveTurn {
        final String turnId;
        final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        volatile TurnPhase phase = TurnPhase.IDLE;
        private Stream<String> stream;
        private boolean streamClosed;

        ActiveTurn(String turnId) {
            this.turnId = turnId;
        }

        boolean isCancelled() {
            return cancelled.get();
        }

        /**
         * @return {@code true} on the first call
         */
        boolean cancel() {
            if (!cancelled.compareAndSet(false, true)) {
                return false;
            }
            // Wake the turn thread if it is waiting for model output
            signals.offer(Signal.END);
            closeStream();
            return true;
        }

        synchronized boolean attach(Stream<String> tokens) {
            if (streamClosed) {
                tokens.close();
                return false;
            }
            stream = tokens;
            return true;
        }

        synchronized boolean isStreamClosed() {
            return streamClosed;
        }

        synchronized void closeStream() {
            if (streamClosed) {
                return;
            }
            streamClosed = true;
            if (stream != null) {
                try {
                    stream.close();
                } catch (RuntimeException e) {
                    LOG.debug("Error closing token stream: {}", e.toString());
                }
            }
        }
    }

    /**
     * Builder for {@link TurnOrchestrator}.
     */
    public static final class Builder {
        private String sessionId;
        private ConversationStateMachine stateMachine;
        private PromptAssembler promptAssembler;
        private LlmClient llmClient;
        private SynthesisWorker synthesisWorker;
        private PlaybackDevice playbackDevice;
        private Executor llmExecutor;
        private ApplicationEventPublisher publisher;
        private TurnMetricsPublisher metrics;
        private ConversationProperties conversation = ConversationProperties.defaults();
        private long modelTimeoutMs = 120_000L;
        private int sentencesPerUnit = 1;

        private Builder() {
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder stateMachine(ConversationStateMachine stateMachine) {
            this.stateMachine = stateMachine;
            return this;
        }

        public Builder promptAssembler(PromptAssembler promptAssembler) {
            this.promptAssembler = promptAssembler;
            return this;
        }

        public Builder llmClient(LlmClient llmClient) {
            this.llmClient = llmClient;
            return this;
        }

        public Builder synthesisWorker(SynthesisWorker synthesisWorker) {
            this.synthesisWorker = synthesisWorker;
            return this;
        }

        public Builder playbackDevice(PlaybackDevice playbackDevice) {
            this.playbackDevice = playbackDevice;
            return this;
        }

        public Builder llmExecutor(Executor llmExecutor) {
            this.llmExecutor = llmExecutor;
            return this;
        }

        public Builder publisher(ApplicationEventPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder metrics(TurnMetricsPublisher metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder conversation(ConversationProperties conversation) {
            this.conversation = conversation;
            return this;
        }

        public Builder modelTimeoutMs(long modelTimeoutMs) {
            this.modelTimeoutMs = modelTimeoutMs;
            return this;
        }

        public Builder sentencesPerUnit(int sentencesPerUnit) {
            this.sentencesPerUnit = sentencesPerUnit;
            return this;
        }

        public TurnOrchestrator build() {
            return new TurnOrchestrator(this);
        }
    }
}
