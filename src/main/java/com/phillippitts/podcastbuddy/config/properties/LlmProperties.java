package com.phillippitts.podcastbuddy.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the Ollama language-model server and its sampling options.
 */
@Validated
@ConfigurationProperties(prefix = "podcast.llm")
public class LlmProperties {

    @NotBlank
    private final String baseUrl;

    @NotBlank
    private final String model;

    /**
     * Maximum wait for the next token while a turn is streaming. Also used as the
     * request timeout for non-streaming calls.
     */
    @Min(1)
    private final long timeoutMs;

    @Min(1)
    private final long connectTimeoutMs;

    @Min(1)
    private final int numPredict;

    @Min(1)
    private final int numCtx;

    @DecimalMin("0.0")
    private final double temperature;

    @Min(1)
    private final int topK;

    @DecimalMin("0.0")
    private final double topP;

    @DecimalMin("0.0")
    private final double repeatPenalty;

    @ConstructorBinding
    public LlmProperties(String baseUrl,
                         String model,
                         Long timeoutMs,
                         Long connectTimeoutMs,
                         Integer numPredict,
                         Integer numCtx,
                         Double temperature,
                         Integer topK,
                         Double topP,
                         Double repeatPenalty) {
        this.baseUrl = baseUrl == null ? "http://localhost:11434" : stripTrailingSlash(baseUrl);
        this.model = model == null ? "llama3" : model;
        this.timeoutMs = timeoutMs == null ? 120_000L : timeoutMs;
        this.connectTimeoutMs = connectTimeoutMs == null ? 5_000L : connectTimeoutMs;
        this.numPredict = numPredict == null ? 150 : numPredict;
        this.numCtx = numCtx == null ? 2048 : numCtx;
        this.temperature = temperature == null ? 0.8 : temperature;
        this.topK = topK == null ? 40 : topK;
        this.topP = topP == null ? 0.9 : topP;
        this.repeatPenalty = repeatPenalty == null ? 1.1 : repeatPenalty;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getModel() {
        return model;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public int getNumPredict() {
        return numPredict;
    }

    public int getNumCtx() {
        return numCtx;
    }

    public double getTemperature() {
        return temperature;
    }

    public int getTopK() {
        return topK;
    }

    public double getTopP() {
        return topP;
    }

    public double getRepeatPenalty() {
        return repeatPenalty;
    }
}
