package com.phillippitts.podcastbuddy.service.memory;

import java.util.Optional;

/**
 * Long-lived knowledge about the user, carried across sessions and summarised into the prompt.
 *
 * <p>Implementations must be thread-safe; the conversation layer calls them from turn threads.
 * Failures are reported as unchecked exceptions; callers treat memory as best-effort.
 */
public interface MemoryStore {

    /** Records that a topic was discussed. */
    void recordTopic(String topic);

    /** Records an opinion the user expressed about a topic. */
    void recordOpinion(String topic, String opinion);

    /**
     * Returns a short plain-text summary for the system prompt, or an empty string when
     * nothing is known yet.
     */
    String contextSummary();

    Optional<String> getPreference(String key);

    void setPreference(String key, String value);

    /** Marks the start of a new conversation session. */
    void incrementSession();
}
