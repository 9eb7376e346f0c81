package com.phillippitts.podcastbuddy.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for audio playback.
 */
@Validated
@ConfigurationProperties(prefix = "podcast.playback")
public class PlaybackProperties {

    /**
     * External player used when Java Sound fails; the WAV path is appended as last argument.
     * Empty disables the fallback device.
     */
    private final List<String> fallbackCommand;

    @Min(1)
    private final int fallbackTimeoutSeconds;

    @ConstructorBinding
    public PlaybackProperties(List<String> fallbackCommand, Integer fallbackTimeoutSeconds) {
        this.fallbackCommand = fallbackCommand == null ? List.of("aplay") : List.copyOf(fallbackCommand);
        this.fallbackTimeoutSeconds = fallbackTimeoutSeconds == null ? 120 : fallbackTimeoutSeconds;
    }

    public List<String> getFallbackCommand() {
        return fallbackCommand;
    }

    public int getFallbackTimeoutSeconds() {
        return fallbackTimeoutSeconds;
    }
}
