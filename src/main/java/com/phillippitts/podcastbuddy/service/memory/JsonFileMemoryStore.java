package com.phillippitts.podcastbuddy.service.memory;

import com.phillippitts.podcastbuddy.config.properties.MemoryProperties;
import com.phillippitts.podcastbuddy.exception.PodcastBuddyException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * {@link MemoryStore} persisted as a single JSON document.
 *
 * <p>File layout:
 * <pre>{@code
 * {
 *   "topics_discussed": [{"topic": "...", "timestamp": "..."}],
 *   "user_opinions":    [{"topic": "...", "opinion": "...", "timestamp": "..."}],
 *   "preferences":      {"key": "value"},
 *   "conversation_count": 3,
 *   "last_session": "2024-05-01T10:15:30Z"
 * }
 * }</pre>
 *
 * <p>Every mutation is written through to disk. A missing or malformed file starts an empty
 * memory; write failures are logged and the in-memory state is kept.
 *
 * <p><b>Thread Safety:</b> All public methods are synchronized on this instance.
 */
public class JsonFileMemoryStore implements MemoryStore {

    private static final Logger LOG = LogManager.getLogger(JsonFileMemoryStore.class);

    static final String TOPICS = "topics_discussed";
    static final String OPINIONS = "user_opinions";
    static final String PREFERENCES = "preferences";
    static final String CONVERSATION_COUNT = "conversation_count";
    static final String LAST_SESSION = "last_session";

    private final Path file;
    private final int maxEntries;
    private final int summaryEntries;
    private final Clock clock;
    private JSONObject data;

    public JsonFileMemoryStore(MemoryProperties properties) {
        this(Path.of(properties.getFile()), properties.getMaxEntries(), properties.getSummaryEntries(),
                Clock.systemUTC());
    }

    JsonFileMemoryStore(Path file, int maxEntries, int summaryEntries, Clock clock) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.maxEntries = maxEntries;
        this.summaryEntries = summaryEntries;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.data = load();
    }

    @Override
    public synchronized void recordTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            return;
        }
        JSONObject entry = new JSONObject()
                .put("topic", topic)
                .put("timestamp", clock.instant().toString());
        append(TOPICS, entry);
        save();
    }

    @Override
    public synchronized void recordOpinion(String topic, String opinion) {
        if (opinion == null || opinion.isBlank()) {
            return;
        }
        JSONObject entry = new JSONObject()
                .put("topic", topic == null ? "" : topic)
                .put("opinion", opinion)
                .put("timestamp", clock.instant().toString());
        append(OPINIONS, entry);
        save();
        LOG.info("Saved user opinion on '{}'", topic);
    }

    @Override
    public synchronized String contextSummary() {
        List<String> parts = new ArrayList<>();

        List<JSONObject> topics = tail(data.getJSONArray(TOPICS), summaryEntries);
        if (!topics.isEmpty()) {
            StringJoiner joiner = new StringJoiner(", ");
            topics.forEach(t -> joiner.add(t.optString("topic")));
            parts.add("Recently discussed topics: " + joiner);
        }

        List<JSONObject> opinions = tail(data.getJSONArray(OPINIONS), summaryEntries);
        if (!opinions.isEmpty()) {
            StringJoiner joiner = new StringJoiner("; ");
            opinions.forEach(o -> joiner.add(o.optString("topic") + ": " + o.optString("opinion")));
            parts.add("User opinions: " + joiner);
        }

        JSONObject prefs = data.getJSONObject(PREFERENCES);
        if (!prefs.isEmpty()) {
            StringJoiner joiner = new StringJoiner(", ");
            prefs.keySet().stream().sorted().forEach(k -> joiner.add(k + "=" + prefs.optString(k)));
            parts.add("User preferences: " + joiner);
        }

        int sessions = data.optInt(CONVERSATION_COUNT, 0);
        if (sessions > 0) {
            parts.add("This is conversation session #" + (sessions + 1));
        }
        return String.join("\n", parts);
    }

    @Override
    public synchronized Optional<String> getPreference(String key) {
        JSONObject prefs = data.getJSONObject(PREFERENCES);
        return prefs.has(key) ? Optional.of(prefs.optString(key)) : Optional.empty();
    }

    @Override
    public synchronized void setPreference(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        data.getJSONObject(PREFERENCES).put(key, value);
        save();
    }

    @Override
    public synchronized void incrementSession() {
        data.put(CONVERSATION_COUNT, data.optInt(CONVERSATION_COUNT, 0) + 1);
        save();
    }

    synchronized int conversationCount() {
        return data.optInt(CONVERSATION_COUNT, 0);
    }

    synchronized int topicCount() {
        return data.getJSONArray(TOPICS).length();
    }

    private void append(String key, JSONObject entry) {
        JSONArray entries = data.getJSONArray(key);
        entries.put(entry);
        while (entries.length() > maxEntries) {
            entries.remove(0);
        }
    }

    private static List<JSONObject> tail(JSONArray entries, int count) {
        List<JSONObject> result = new ArrayList<>();
        for (int i = Math.max(0, entries.length() - count); i < entries.length(); i++) {
            JSONObject entry = entries.optJSONObject(i);
            if (entry != null) {
                result.add(entry);
            }
        }
        return result;
    }

    private JSONObject load() {
        JSONObject loaded = emptyDocument();
        if (!Files.exists(file)) {
            return loaded;
        }
        try {
            JSONObject saved = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            for (String key : saved.keySet()) {
                loaded.put(key, saved.get(key));
            }
            ensureShape(loaded);
            LOG.info("Memory loaded: {} topics, {} opinions",
                    loaded.getJSONArray(TOPICS).length(), loaded.getJSONArray(OPINIONS).length());
            return loaded;
        } catch (IOException | JSONException | PodcastBuddyException e) {
            LOG.warn("Could not load memory from {}: {}", file, e.toString());
            return emptyDocument();
        }
    }

    private void save() {
        data.put(LAST_SESSION, clock.instant().toString());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, data.toString(2), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            LOG.error("Could not save memory to {}: {}", file, e.toString());
        }
    }

    private static JSONObject emptyDocument() {
        return new JSONObject()
                .put(TOPICS, new JSONArray())
                .put(OPINIONS, new JSONArray())
                .put(PREFERENCES, new JSONObject())
                .put(CONVERSATION_COUNT, 0)
                .put(LAST_SESSION, JSONObject.NULL);
    }

    private static void ensureShape(JSONObject doc) {
        if (doc.optJSONArray(TOPICS) == null || doc.optJSONArray(OPINIONS) == null
                || doc.optJSONObject(PREFERENCES) == null) {
            throw new PodcastBuddyException("memory document has unexpected shape");
        }
    }
}
