package com.phillippitts.podcastbuddy.service.llm;

import com.phillippitts.podcastbuddy.config.properties.LlmProperties;
import com.phillippitts.podcastbuddy.domain.ChatMessage;
import com.phillippitts.podcastbuddy.exception.ModelUnavailableException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the client against a local stub of the Ollama HTTP API.
 */
class OllamaLlmClientTest {

    private static final List<ChatMessage> PROMPT =
            List.of(ChatMessage.system("You are a host."), ChatMessage.user("hello"));

    private HttpServer server;
    private final AtomicReference<String> lastBody = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private OllamaLlmClient client() {
        return new OllamaLlmClient(properties("http://127.0.0.1:" + server.getAddress().getPort() + "/"));
    }

    private static LlmProperties properties(String baseUrl) {
        return new LlmProperties(baseUrl, "llama3", 5_000L, 1_000L, 150, 2048, 0.8, 40, 0.9, 1.1);
    }

    private void respond(String path, int status, String body) {
        server.createContext(path, exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            write(exchange, status, body);
        });
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    void chatPayloadCarriesModelMessagesAndSamplingOptions() {
        JSONObject payload = client().chatPayload(PROMPT, true);

        assertThat(payload.getString("model")).isEqualTo("llama3");
        assertThat(payload.getBoolean("stream")).isTrue();
        assertThat(payload.getJSONArray("messages").getJSONObject(0).getString("role")).isEqualTo("system");
        assertThat(payload.getJSONArray("messages").getJSONObject(1).getString("content")).isEqualTo("hello");
        JSONObject options = payload.getJSONObject("options");
        assertThat(options.getInt("num_predict")).isEqualTo(150);
        assertThat(options.getInt("num_ctx")).isEqualTo(2048);
        assertThat(options.getInt("top_k")).isEqualTo(40);
        assertThat(options.getDouble("repeat_penalty")).isEqualTo(1.1);
    }

    @Test
    void streamChatYieldsFragmentsUntilDone() {
        respond("/api/chat", 200, String.join("\n",
                "{\"message\":{\"role\":\"assistant\",\"content\":\"Hello \"},\"done\":false}",
                "",
                "{\"message\":{\"role\":\"assistant\",\"content\":\"there.\"},\"done\":false}",
                "{\"message\":{\"role\":\"assistant\",\"content\":\"\"},\"done\":true}",
                "{\"message\":{\"role\":\"assistant\",\"content\":\"ignored\"},\"done\":false}"));

        List<String> fragments;
        try (Stream<String> stream = client().streamChat(PROMPT)) {
            fragments = stream.collect(Collectors.toList());
        }

        assertThat(fragments).containsExactly("Hello ", "there.");
        assertThat(new JSONObject(lastBody.get()).getBoolean("stream")).isTrue();
    }

    @Test
    void errorLineInStreamIsThrownWhileIterating() {
        respond("/api/chat", 200, String.join("\n",
                "{\"message\":{\"content\":\"Hi\"},\"done\":false}",
                "{\"error\":\"model crashed\"}"));

        try (Stream<String> stream = client().streamChat(PROMPT)) {
            assertThatThrownBy(() -> stream.collect(Collectors.toList()))
                    .isInstanceOf(ModelUnavailableException.class)
                    .hasMessageContaining("model crashed");
        }
    }

    @Test
    void nonOkStatusIsModelUnavailable() {
        respond("/api/chat", 404, "{\"error\":\"model 'llama3' not found\"}");

        assertThatThrownBy(() -> client().streamChat(PROMPT))
                .isInstanceOf(ModelUnavailableException.class)
                .hasMessageContaining("HTTP 404");
    }

    @Test
    void chatReturnsTrimmedReply() {
        respond("/api/chat", 200, "{\"message\":{\"role\":\"assistant\",\"content\":\" Bye now. \"},\"done\":true}");

        assertThat(client().chat(PROMPT)).isEqualTo("Bye now.");
        assertThat(new JSONObject(lastBody.get()).getBoolean("stream")).isFalse();
    }

    @Test
    void readinessAndWarmUpUseTheirEndpoints() {
        respond("/api/tags", 200, "{\"models\":[{\"name\":\"llama3:latest\"}]}");
        respond("/api/generate", 200, "{\"response\":\"Hi\",\"done\":true}");

        OllamaLlmClient client = client();

        assertThat(client.isReady()).isTrue();
        client.warmUp();
        assertThat(new JSONObject(lastBody.get()).getString("prompt")).isEqualTo("Hi");
    }

    @Test
    void unreachableServerIsReportedAsUnavailable() throws IOException {
        HttpServer stopped = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        int port = stopped.getAddress().getPort();
        stopped.start();
        stopped.stop(0);
        OllamaLlmClient client = new OllamaLlmClient(properties("http://127.0.0.1:" + port));

        assertThat(client.isReady()).isFalse();
        assertThatThrownBy(() -> client.streamChat(PROMPT))
                .isInstanceOf(ModelUnavailableException.class)
                .hasMessageContaining("Cannot connect to Ollama");
    }
}
