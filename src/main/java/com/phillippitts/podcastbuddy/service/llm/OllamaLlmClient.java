package com.phillippitts.podcastbuddy.service.llm;

import com.phillippitts.podcastbuddy.config.properties.LlmProperties;
import com.phillippitts.podcastbuddy.domain.ChatMessage;
import com.phillippitts.podcastbuddy.exception.ModelTimeoutException;
import com.phillippitts.podcastbuddy.exception.ModelUnavailableException;
import com.phillippitts.podcastbuddy.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * {@link LlmClient} for a local Ollama server.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/chat} with {@code "stream": true} for turns (newline-delimited JSON)</li>
 *   <li>{@code POST /api/chat} with {@code "stream": false} for {@link #chat(List)}</li>
 *   <li>{@code GET /api/tags} for readiness</li>
 *   <li>{@code POST /api/generate} with a one-word prompt for warm-up</li>
 * </ul>
 *
 * <p>Sampling options ({@code num_predict}, {@code num_ctx}, {@code temperature}, {@code top_k},
 * {@code top_p}, {@code repeat_penalty}) come from {@link LlmProperties}.
 */
public class OllamaLlmClient implements LlmClient {

    private static final Logger LOG = LogManager.getLogger(OllamaLlmClient.class);
    private static final Duration READY_TIMEOUT = Duration.ofSeconds(5);

    private final LlmProperties properties;
    private final HttpClient httpClient;

    public OllamaLlmClient(LlmProperties properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .build());
    }

    OllamaLlmClient(LlmProperties properties, HttpClient httpClient) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    @Override
    public Stream<String> streamChat(List<ChatMessage> messages) {
        String url = properties.getBaseUrl() + "/api/chat";
        HttpRequest request = jsonPost(url, chatPayload(messages, true));
        long start = System.nanoTime();

        HttpResponse<Stream<String>> response = send(request, HttpResponse.BodyHandlers.ofLines(), url);
        if (response.statusCode() != 200) {
            response.body().close();
            throw new ModelUnavailableException("Ollama returned HTTP " + response.statusCode(), url, null);
        }
        LOG.debug("Ollama stream opened in {}ms (model={})", TimeUtils.elapsedMillis(start), properties.getModel());

        Stream<String> lines = response.body();
        return lines
                .map(OllamaChunkParser::parse)
                .takeWhile(new NotPastDone())
                .peek(chunk -> {
                    if (chunk.hasError()) {
                        throw new ModelUnavailableException("Ollama stream error: " + chunk.error(), url, null);
                    }
                })
                .map(OllamaChunkParser.Chunk::content)
                .filter(content -> !content.isEmpty());
    }

    @Override
    public String chat(List<ChatMessage> messages) {
        String url = properties.getBaseUrl() + "/api/chat";
        HttpResponse<String> response = send(jsonPost(url, chatPayload(messages, false)),
                HttpResponse.BodyHandlers.ofString(), url);
        if (response.statusCode() != 200) {
            throw new ModelUnavailableException("Ollama returned HTTP " + response.statusCode(), url, null);
        }
        return OllamaChunkParser.parseReply(response.body());
    }

    @Override
    public boolean isReady() {
        String url = properties.getBaseUrl() + "/api/tags";
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(READY_TIMEOUT)
                .GET()
                .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() == 200;
        } catch (IOException e) {
            LOG.debug("Ollama not reachable at {}: {}", url, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void warmUp() {
        String url = properties.getBaseUrl() + "/api/generate";
        JSONObject payload = new JSONObject()
                .put("model", properties.getModel())
                .put("prompt", "Hi")
                .put("stream", false)
                .put("options", new JSONObject().put("num_predict", 1));
        long start = System.nanoTime();
        HttpResponse<Void> response = send(jsonPost(url, payload), HttpResponse.BodyHandlers.discarding(), url);
        if (response.statusCode() != 200) {
            throw new ModelUnavailableException("Ollama warm-up returned HTTP " + response.statusCode(), url, null);
        }
        LOG.info("Ollama model '{}' warmed up in {}ms", properties.getModel(), TimeUtils.elapsedMillis(start));
    }

    @Override
    public String name() {
        return "ollama";
    }

    JSONObject chatPayload(List<ChatMessage> messages, boolean stream) {
        JSONArray array = new JSONArray();
        for (ChatMessage message : messages) {
            array.put(new JSONObject()
                    .put("role", message.role().wireName())
                    .put("content", message.content()));
        }
        JSONObject options = new JSONObject()
                .put("num_predict", properties.getNumPredict())
                .put("num_ctx", properties.getNumCtx())
                .put("temperature", properties.getTemperature())
                .put("top_k", properties.getTopK())
                .put("top_p", properties.getTopP())
                .put("repeat_penalty", properties.getRepeatPenalty());
        return new JSONObject()
                .put("model", properties.getModel())
                .put("messages", array)
                .put("stream", stream)
                .put("options", options);
    }

    private HttpRequest jsonPost(String url, JSONObject payload) {
        return HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build();
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler, String url) {
        try {
            return httpClient.send(request, handler);
        } catch (HttpTimeoutException e) {
            throw new ModelTimeoutException("Ollama request timed out", properties.getTimeoutMs(), e);
        } catch (IOException e) {
            throw new ModelUnavailableException("Cannot connect to Ollama. Is it running? (ollama serve)", url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelUnavailableException("Interrupted while calling Ollama", url, e);
        }
    }

    /**
     * Passes chunks up to and including the first one flagged {@code done}.
     */
    private static final class NotPastDone implements Predicate<OllamaChunkParser.Chunk> {
        private boolean finished;

        @Override
        public boolean test(OllamaChunkParser.Chunk chunk) {
            if (finished) {
                return false;
            }
            finished = chunk.done();
            return true;
        }
    }
}
