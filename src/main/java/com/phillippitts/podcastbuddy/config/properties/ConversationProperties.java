package com.phillippitts.podcastbuddy.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for the conversation layer: persona, history window, stop phrases and
 * the canned lines spoken when the model cannot answer.
 */
@Validated
@ConfigurationProperties(prefix = "podcast.conversation")
public class ConversationProperties {

    public static final String DEFAULT_SYSTEM_PROMPT = """
            You are a smart, energetic podcast host and driving companion.
            You never end conversations.
            You explain clearly.
            You ask engaging questions.
            You speak casually like a friend in a car.
            You use examples and stories.
            Keep responses concise, under 4 sentences unless explaining something complex.
            Always end with a question or invitation to continue.""";

    public static final List<String> DEFAULT_STOP_PHRASES =
            List.of("stop", "quit", "exit", "bye", "goodbye", "end podcast", "shut up");

    @Min(1)
    private final int maxHistory;

    @NotBlank
    private final String systemPrompt;

    @NotNull
    private final List<String> stopPhrases;

    @NotBlank
    private final String unavailableApology;

    @NotBlank
    private final String timeoutApology;

    @NotBlank
    private final String streamErrorApology;

    @NotBlank
    private final String errorApology;

    @ConstructorBinding
    public ConversationProperties(Integer maxHistory,
                                  String systemPrompt,
                                  List<String> stopPhrases,
                                  String unavailableApology,
                                  String timeoutApology,
                                  String streamErrorApology,
                                  String errorApology) {
        this.maxHistory = maxHistory == null ? 20 : maxHistory;
        this.systemPrompt = systemPrompt == null ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
        this.stopPhrases = stopPhrases == null ? DEFAULT_STOP_PHRASES : List.copyOf(stopPhrases);
        this.unavailableApology = unavailableApology == null
                ? "Sorry, I can't reach my brain right now. Is Ollama running?" : unavailableApology;
        this.timeoutApology = timeoutApology == null
                ? "Hmm, that took too long. Let me try again." : timeoutApology;
        this.streamErrorApology = streamErrorApology == null
                ? "Sorry, lost my train of thought!" : streamErrorApology;
        this.errorApology = errorApology == null
                ? "I had a brain glitch. Let's keep going though!" : errorApology;
    }

    /**
     * Defaults for tests and programmatic wiring.
     */
    public static ConversationProperties defaults() {
        return new ConversationProperties(null, null, null, null, null, null, null);
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public List<String> getStopPhrases() {
        return stopPhrases;
    }

    public String getUnavailableApology() {
        return unavailableApology;
    }

    public String getTimeoutApology() {
        return timeoutApology;
    }

    public String getStreamErrorApology() {
        return streamErrorApology;
    }

    public String getErrorApology() {
        return errorApology;
    }
}
