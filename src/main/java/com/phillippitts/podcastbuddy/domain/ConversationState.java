package com.phillippitts.podcastbuddy.domain;

/**
 * Conversational mode the host is in for the next response.
 *
 * <p>Default cycle (no silence override):
 * <pre>
 * INTRO → EXPLAIN → ASK → REACT → EXPAND → ASK → ...
 * </pre>
 * EXPAND loops back to ASK; INTRO is only re-entered when a new topic is set.
 * There is no terminal state.
 */
public enum ConversationState {

    INTRO("You are starting a new topic. Introduce it with excitement and energy. "
            + "Give a brief hook about why this is interesting. End with a question."),

    EXPLAIN("Explain the current topic in a clear, simple way. "
            + "Use analogies and real-world examples. Keep it conversational."),

    ASK("Ask the user a thought-provoking question about the topic. "
            + "Make it personal - 'what do you think?', 'have you ever...?'"),

    REACT("React to what the user just said. Show genuine interest. "
            + "Build on their point. Add your perspective."),

    EXPAND("Expand the discussion. Bring in a related angle, a counter-argument, "
            + "or a fun fact. Keep the energy up.");

    private final String instruction;

    ConversationState(String instruction) {
        this.instruction = instruction;
    }

    /**
     * Returns the fixed instruction block injected into the system prompt for this state.
     *
     * @return instruction text, never null
     */
    public String instruction() {
        return instruction;
    }

    /**
     * Returns the next state of the default cycle, ignoring any silence override.
     *
     * @return successor state
     */
    public ConversationState next() {
        return switch (this) {
            case INTRO -> EXPLAIN;
            case EXPLAIN -> ASK;
            case ASK -> REACT;
            case REACT -> EXPAND;
            case EXPAND -> ASK;
        };
    }
}
