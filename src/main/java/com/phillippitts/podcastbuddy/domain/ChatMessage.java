package com.phillippitts.podcastbuddy.domain;

import java.util.Objects;

/**
 * One message of a chat-style prompt.
 *
 * @param role author of the message
 * @param content message text (never null)
 */
public record ChatMessage(Role role, String content) {

    public enum Role {
        SYSTEM, USER, ASSISTANT;

        /** Lower-case wire name used by chat-completion APIs. */
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(Role.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(Role.USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(Role.ASSISTANT, content);
    }
}
