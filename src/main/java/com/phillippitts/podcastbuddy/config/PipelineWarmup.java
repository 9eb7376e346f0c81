package com.phillippitts.podcastbuddy.config;

import com.phillippitts.podcastbuddy.service.llm.LlmClient;
import com.phillippitts.podcastbuddy.service.synthesis.SynthesisWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Loads the language model and the synthesis engine once the application is ready, so the
 * first turn does not pay the load cost. Failures are logged and never stop the application.
 */
@Component
@ConditionalOnProperty(name = "podcast.warmup.enabled", havingValue = "true", matchIfMissing = true)
class PipelineWarmup {

    private static final Logger LOG = LogManager.getLogger(PipelineWarmup.class);

    private final LlmClient llmClient;
    private final SynthesisWorker synthesisWorker;

    PipelineWarmup(LlmClient llmClient, SynthesisWorker synthesisWorker) {
        this.llmClient = llmClient;
        this.synthesisWorker = synthesisWorker;
    }

    @EventListener(ApplicationReadyEvent.class)
    void onReady() {
        warmUpModel();
        warmUpSynthesis();
    }

    // Visible for tests
    void warmUpModel() {
        try {
            if (!llmClient.isReady()) {
                LOG.warn("Language model '{}' not reachable; turns will apologize until it is", llmClient.name());
                return;
            }
            llmClient.warmUp();
        } catch (RuntimeException e) {
            LOG.error("Language model warm-up failed: {}", e.getMessage());
        }
    }

    // Visible for tests
    void warmUpSynthesis() {
        try {
            synthesisWorker.warmUp();
        } catch (RuntimeException e) {
            LOG.error("Synthesis warm-up failed: {}", e.getMessage());
        }
    }
}
