package com.phillippitts.podcastbuddy.service.conversation;

import com.phillippitts.podcastbuddy.domain.ChatMessage;
import com.phillippitts.podcastbuddy.domain.ConversationState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the message list sent to the language model for one turn.
 *
 * <p>Layout:
 * <ol>
 *   <li>system: persona, {@code Current conversation state: STATE}, state instruction and
 *       optional {@code User memory:} block;</li>
 *   <li>system (optional): {@code Today's discussion topic context:} block;</li>
 *   <li>conversation history, oldest first;</li>
 *   <li>user: the user's words, or a silence prompt when they said nothing.</li>
 * </ol>
 */
public final class PromptAssembler {

    static final String SILENT_USER_PLACEHOLDER =
            "(The user is silent - prompt them with something interesting or ask a question)";

    static final List<String> SILENCE_PROMPTS = List.of(
            "The user has been quiet. Ask them an engaging question.",
            "Fill the silence with an interesting fact, then ask for their take.",
            "The user might be thinking. Offer a perspective and invite them to respond.",
            "Keep the conversation going! Share a story related to the topic.");

    static final String FAREWELL_PROMPT =
            "The user wants to end the podcast. Give a warm, short farewell. Thank them.";

    private final String persona;

    public PromptAssembler(String persona) {
        this.persona = Objects.requireNonNull(persona, "persona must not be null");
    }

    public List<ChatMessage> assemble(ConversationState state,
                                      String memorySummary,
                                      String topicContext,
                                      List<ChatMessage> history,
                                      String userMessage) {
        List<ChatMessage> messages = new ArrayList<>(history.size() + 3);
        messages.add(ChatMessage.system(systemPrompt(state, memorySummary)));
        if (topicContext != null && !topicContext.isBlank()) {
            messages.add(ChatMessage.system("Today's discussion topic context:\n" + topicContext));
        }
        messages.addAll(history);
        String content = userMessage == null || userMessage.isBlank() ? SILENT_USER_PLACEHOLDER : userMessage;
        messages.add(ChatMessage.user(content));
        return messages;
    }

    String systemPrompt(ConversationState state, String memorySummary) {
        StringBuilder sb = new StringBuilder(persona)
                .append("\n\n")
                .append("Current conversation state: ").append(state.name()).append('\n')
                .append(state.instruction());
        if (memorySummary != null && !memorySummary.isBlank()) {
            sb.append("\n\nUser memory:\n").append(memorySummary);
        }
        return sb.toString();
    }

    /**
     * Prompt used in place of the user's words after a silent turn; rotates with the turn count.
     */
    public String silencePrompt(int turnCount) {
        return SILENCE_PROMPTS.get(Math.floorMod(turnCount, SILENCE_PROMPTS.size()));
    }

    public String introPrompt(String topic) {
        String subject = topic == null || topic.isBlank() ? "something interesting" : topic;
        return "Let's start today's podcast episode! The topic is: " + subject + ". "
                + "Introduce it with energy and excitement. Hook the listener.";
    }

    public String farewellPrompt() {
        return FAREWELL_PROMPT;
    }
}
