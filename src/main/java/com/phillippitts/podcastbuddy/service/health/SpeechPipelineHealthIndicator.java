package com.phillippitts.podcastbuddy.service.health;

import com.phillippitts.podcastbuddy.service.llm.LlmClient;
import com.phillippitts.podcastbuddy.service.playback.PlaybackDevice;
import com.phillippitts.podcastbuddy.service.synthesis.SynthesisWorker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the speaking pipeline.
 *
 * <ul>
 *   <li>UP: language model reachable and synthesis engine healthy</li>
 *   <li>DEGRADED: only one of them is usable (turns apologize or drop sentences)</li>
 *   <li>DOWN: neither is usable</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SpeechPipelineHealthIndicator implements HealthIndicator {

    private final LlmClient llmClient;
    private final SynthesisWorker synthesisWorker;
    private final PlaybackDevice playbackDevice;

    public SpeechPipelineHealthIndicator(LlmClient llmClient,
                                         SynthesisWorker synthesisWorker,
                                         PlaybackDevice playbackDevice) {
        this.llmClient = llmClient;
        this.synthesisWorker = synthesisWorker;
        this.playbackDevice = playbackDevice;
    }

    @Override
    public Health health() {
        boolean modelReady = llmClient.isReady();
        boolean synthesisReady = synthesisWorker.isHealthy();

        Health.Builder builder = new Health.Builder();
        if (modelReady && synthesisReady) {
            builder.up().withDetail("status", "Pipeline operational");
        } else if (modelReady || synthesisReady) {
            builder.status("DEGRADED").withDetail("status", "Partial pipeline availability");
        } else {
            builder.down().withDetail("status", "Model and synthesis unavailable");
        }
        return builder
                .withDetail(llmClient.name(), modelReady ? "ready" : "unreachable")
                .withDetail(synthesisWorker.engineName(), synthesisReady ? "ready" : "unhealthy")
                .withDetail("playback", playbackDevice.isAvailable() ? playbackDevice.name() : "unavailable")
                .build();
    }
}
