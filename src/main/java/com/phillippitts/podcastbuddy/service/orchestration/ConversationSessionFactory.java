package com.phillippitts.podcastbuddy.service.orchestration;

import com.phillippitts.podcastbuddy.config.properties.ConversationProperties;
import com.phillippitts.podcastbuddy.config.properties.LlmProperties;
import com.phillippitts.podcastbuddy.config.properties.SynthesisProperties;
import com.phillippitts.podcastbuddy.domain.TurnContext;
import com.phillippitts.podcastbuddy.service.conversation.ConversationStateMachine;
import com.phillippitts.podcastbuddy.service.conversation.PromptAssembler;
import com.phillippitts.podcastbuddy.service.conversation.StopPhraseDetector;
import com.phillippitts.podcastbuddy.service.llm.LlmClient;
import com.phillippitts.podcastbuddy.service.memory.MemoryStore;
import com.phillippitts.podcastbuddy.service.memory.OpinionExtractor;
import com.phillippitts.podcastbuddy.service.playback.PlaybackDevice;
import com.phillippitts.podcastbuddy.service.synthesis.SynthesisWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Creates {@link ConversationSession}s over the shared model client, synthesis worker, playback
 * device and memory store. Each session gets its own context, state machine and orchestrator.
 */
@Component
public class ConversationSessionFactory {

    private static final Logger LOG = LogManager.getLogger(ConversationSessionFactory.class);

    private final ConversationProperties conversation;
    private final LlmProperties llm;
    private final SynthesisProperties synthesis;
    private final MemoryStore memory;
    private final OpinionExtractor opinionExtractor;
    private final PromptAssembler promptAssembler;
    private final StopPhraseDetector stopPhrases;
    private final LlmClient llmClient;
    private final SynthesisWorker synthesisWorker;
    private final PlaybackDevice playbackDevice;
    private final Executor llmExecutor;
    private final ApplicationEventPublisher publisher;
    private final TurnMetricsPublisher metrics;

    public ConversationSessionFactory(ConversationProperties conversation,
                                      LlmProperties llm,
                                      SynthesisProperties synthesis,
                                      MemoryStore memory,
                                      OpinionExtractor opinionExtractor,
                                      PromptAssembler promptAssembler,
                                      StopPhraseDetector stopPhrases,
                                      LlmClient llmClient,
                                      SynthesisWorker synthesisWorker,
                                      PlaybackDevice playbackDevice,
                                      @Qualifier("llmStreamExecutor") Executor llmExecutor,
                                      ApplicationEventPublisher publisher,
                                      TurnMetricsPublisher metrics) {
        this.conversation = conversation;
        this.llm = llm;
        this.synthesis = synthesis;
        this.memory = memory;
        this.opinionExtractor = opinionExtractor;
        this.promptAssembler = promptAssembler;
        this.stopPhrases = stopPhrases;
        this.llmClient = llmClient;
        this.synthesisWorker = synthesisWorker;
        this.playbackDevice = playbackDevice;
        this.llmExecutor = llmExecutor;
        this.publisher = publisher;
        this.metrics = metrics;
    }

    /**
     * Opens a new session and bumps the persisted session counter.
     */
    public ConversationSession create() {
        String sessionId = UUID.randomUUID().toString().substring(0, 8);
        ConversationStateMachine stateMachine = new ConversationStateMachine(
                new TurnContext(conversation.getMaxHistory()), memory, opinionExtractor);
        TurnOrchestrator orchestrator = TurnOrchestrator.builder()
                .sessionId(sessionId)
                .stateMachine(stateMachine)
                .promptAssembler(promptAssembler)
                .llmClient(llmClient)
                .synthesisWorker(synthesisWorker)
                .playbackDevice(playbackDevice)
                .llmExecutor(llmExecutor)
                .publisher(publisher)
                .metrics(metrics)
                .conversation(conversation)
                .modelTimeoutMs(llm.getTimeoutMs())
                .sentencesPerUnit(synthesis.getSentencesPerUnit())
                .build();
        try {
            memory.incrementSession();
        } catch (RuntimeException e) {
            LOG.warn("Could not record session start in memory: {}", e.getMessage());
        }
        LOG.info("Session {} created", sessionId);
        return new ConversationSession(sessionId, stateMachine, orchestrator, stopPhrases);
    }
}
