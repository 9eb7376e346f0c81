package com.phillippitts.podcastbuddy.service.llm;

import com.phillippitts.podcastbuddy.domain.ChatMessage;
import com.phillippitts.podcastbuddy.exception.ModelTimeoutException;
import com.phillippitts.podcastbuddy.exception.ModelUnavailableException;

import java.util.List;
import java.util.stream.Stream;

/**
 * Contract for the language-model server that writes the host's replies.
 *
 * <p>Implementations must be thread-safe; one instance is shared by all sessions.
 */
public interface LlmClient {

    /**
     * Starts a streaming chat completion.
     *
     * <p>The returned stream is lazy: each element is the next text fragment, in order, and the
     * end of the stream is the end-of-reply marker. Closing the stream aborts the request.
     * Errors that occur while iterating are thrown from the stream as unchecked exceptions.
     *
     * @param messages full prompt, system messages first
     * @return lazily populated stream of fragments; the caller must close it
     * @throws ModelUnavailableException if the server cannot be reached or rejects the request
     * @throws ModelTimeoutException if the server does not answer within the configured timeout
     */
    Stream<String> streamChat(List<ChatMessage> messages);

    /**
     * Non-streaming chat completion.
     *
     * @return the complete reply, trimmed
     */
    String chat(List<ChatMessage> messages);

    /**
     * @return true if the server is reachable
     */
    boolean isReady();

    /**
     * Sends a tiny request so the model is loaded before the first real turn.
     */
    void warmUp();

    /** Name for logs/metrics. */
    String name();
}
