package com.phillippitts.podcastbuddy.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for speech synthesis: the Piper process, sentence grouping and the
 * text-length guard applied before synthesis.
 */
@Validated
@ConfigurationProperties(prefix = "podcast.tts")
public class SynthesisProperties {

    @NotBlank
    private final String binaryPath;

    @NotBlank
    private final String modelPath;

    @Min(1)
    private final int timeoutSeconds;

    /** Number of raw sentences merged into one synthesis unit. */
    @Min(1)
    private final int sentencesPerUnit;

    /** Hard cap on characters handed to the engine per unit. */
    @Min(1)
    private final int maxChars;

    /** A sentence boundary before the cap is only used when it lies beyond this offset. */
    @Min(0)
    private final int minBoundaryChars;

    /** Maximum wait for the engine lock before a unit is dropped. */
    @Min(1)
    private final long lockTimeoutMs;

    @ConstructorBinding
    public SynthesisProperties(String binaryPath,
                               String modelPath,
                               Integer timeoutSeconds,
                               Integer sentencesPerUnit,
                               Integer maxChars,
                               Integer minBoundaryChars,
                               Long lockTimeoutMs) {
        this.binaryPath = binaryPath == null ? "piper" : binaryPath;
        this.modelPath = modelPath == null ? "models/en_US-ryan-high.onnx" : modelPath;
        this.timeoutSeconds = timeoutSeconds == null ? 30 : timeoutSeconds;
        this.sentencesPerUnit = sentencesPerUnit == null ? 1 : sentencesPerUnit;
        this.maxChars = maxChars == null ? 500 : maxChars;
        this.minBoundaryChars = minBoundaryChars == null ? 200 : minBoundaryChars;
        this.lockTimeoutMs = lockTimeoutMs == null ? 60_000L : lockTimeoutMs;
    }

    public static SynthesisProperties defaults() {
        return new SynthesisProperties(null, null, null, null, null, null, null);
    }

    public String getBinaryPath() {
        return binaryPath;
    }

    public String getModelPath() {
        return modelPath;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getSentencesPerUnit() {
        return sentencesPerUnit;
    }

    public int getMaxChars() {
        return maxChars;
    }

    public int getMinBoundaryChars() {
        return minBoundaryChars;
    }

    public long getLockTimeoutMs() {
        return lockTimeoutMs;
    }
}
