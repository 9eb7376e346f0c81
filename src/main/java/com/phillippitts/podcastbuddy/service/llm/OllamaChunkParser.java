package com.phillippitts.podcastbuddy.service.llm;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses one line of Ollama's newline-delimited {@code /api/chat} streaming response.
 * Safe against malformed input: unparsable lines yield an empty, non-terminal chunk.
 *
 * <pre>{@code
 * {"message":{"role":"assistant","content":"Hel"},"done":false}
 * {"message":{"role":"assistant","content":""},"done":true,"total_duration":123}
 * {"error":"model 'x' not found"}
 * }</pre>
 */
final class OllamaChunkParser {

    private static final Logger LOG = LogManager.getLogger(OllamaChunkParser.class);

    private OllamaChunkParser() {}

    record Chunk(String content, boolean done, String error) {
        static final Chunk EMPTY = new Chunk("", false, null);

        boolean hasError() {
            return error != null;
        }
    }

    static Chunk parse(String line) {
        if (line == null || line.isBlank()) {
            return Chunk.EMPTY;
        }
        try {
            JSONObject obj = new JSONObject(line);
            if (obj.has("error")) {
                return new Chunk("", true, obj.optString("error", "unknown error"));
            }
            JSONObject message = obj.optJSONObject("message");
            String content = message == null ? "" : message.optString("content", "");
            return new Chunk(content, obj.optBoolean("done", false), null);
        } catch (JSONException e) {
            LOG.debug("Skipping malformed stream line: {}", e.getMessage());
            return Chunk.EMPTY;
        }
    }

    /**
     * Extracts the reply text from a non-streaming {@code /api/chat} response body.
     */
    static String parseReply(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JSONObject message = new JSONObject(body).optJSONObject("message");
            return message == null ? "" : message.optString("content", "").trim();
        } catch (JSONException e) {
            LOG.debug("Malformed chat response: {}", e.getMessage());
            return "";
        }
    }
}
