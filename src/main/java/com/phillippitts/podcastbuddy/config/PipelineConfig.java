package com.phillippitts.podcastbuddy.config;

import com.phillippitts.podcastbuddy.config.properties.ConversationProperties;
import com.phillippitts.podcastbuddy.config.properties.LlmProperties;
import com.phillippitts.podcastbuddy.config.properties.MemoryProperties;
import com.phillippitts.podcastbuddy.config.properties.PlaybackProperties;
import com.phillippitts.podcastbuddy.config.properties.SynthesisProperties;
import com.phillippitts.podcastbuddy.service.conversation.PromptAssembler;
import com.phillippitts.podcastbuddy.service.conversation.StopPhraseDetector;
import com.phillippitts.podcastbuddy.service.llm.LlmClient;
import com.phillippitts.podcastbuddy.service.llm.OllamaLlmClient;
import com.phillippitts.podcastbuddy.service.memory.JsonFileMemoryStore;
import com.phillippitts.podcastbuddy.service.memory.MemoryStore;
import com.phillippitts.podcastbuddy.service.memory.OpinionExtractor;
import com.phillippitts.podcastbuddy.service.playback.CommandPlaybackDevice;
import com.phillippitts.podcastbuddy.service.playback.FallbackPlaybackDevice;
import com.phillippitts.podcastbuddy.service.playback.JavaSoundPlaybackDevice;
import com.phillippitts.podcastbuddy.service.playback.PlaybackDevice;
import com.phillippitts.podcastbuddy.service.process.ProcessRunner;
import com.phillippitts.podcastbuddy.service.synthesis.PiperSynthesisEngine;
import com.phillippitts.podcastbuddy.service.synthesis.SpeechTextCleaner;
import com.phillippitts.podcastbuddy.service.synthesis.SynthesisEngine;
import com.phillippitts.podcastbuddy.service.synthesis.SynthesisGuard;
import com.phillippitts.podcastbuddy.service.synthesis.SynthesisWorker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the process-wide collaborators shared by every conversation session: model client,
 * memory store, synthesis worker and playback device.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public ProcessRunner processRunner() {
        return new ProcessRunner();
    }

    @Bean
    public LlmClient llmClient(LlmProperties properties) {
        return new OllamaLlmClient(properties);
    }

    @Bean
    public MemoryStore memoryStore(MemoryProperties properties) {
        return new JsonFileMemoryStore(properties);
    }

    @Bean
    public OpinionExtractor opinionExtractor() {
        return new OpinionExtractor();
    }

    @Bean
    public PromptAssembler promptAssembler(ConversationProperties properties) {
        return new PromptAssembler(properties.getSystemPrompt());
    }

    @Bean
    public StopPhraseDetector stopPhraseDetector(ConversationProperties properties) {
        return new StopPhraseDetector(properties.getStopPhrases());
    }

    @Bean(destroyMethod = "close")
    public SynthesisEngine synthesisEngine(SynthesisProperties properties, ProcessRunner processRunner) {
        return new PiperSynthesisEngine(properties, processRunner);
    }

    /**
     * Single worker over the single engine: one synthesis guard for all sessions and warm-up.
     */
    @Bean
    public SynthesisWorker synthesisWorker(SynthesisEngine engine, SynthesisProperties properties) {
        return new SynthesisWorker(engine,
                new SpeechTextCleaner(properties.getMaxChars(), properties.getMinBoundaryChars()),
                new SynthesisGuard(properties.getLockTimeoutMs(), engine.getEngineName()));
    }

    /**
     * Java Sound first; the configured external player once per failed unit.
     */
    @Bean
    public PlaybackDevice playbackDevice(PlaybackProperties properties,
                                         ProcessRunner processRunner,
                                         @Qualifier("playbackExecutor") Executor playbackExecutor,
                                         ApplicationEventPublisher publisher) {
        PlaybackDevice fallback = properties.getFallbackCommand().isEmpty()
                ? null
                : new CommandPlaybackDevice(properties.getFallbackCommand(),
                        Duration.ofSeconds(properties.getFallbackTimeoutSeconds()), processRunner, playbackExecutor);
        return new FallbackPlaybackDevice(new JavaSoundPlaybackDevice(), fallback, publisher);
    }
}
