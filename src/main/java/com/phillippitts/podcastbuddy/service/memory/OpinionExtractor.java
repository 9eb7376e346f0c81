package com.phillippitts.podcastbuddy.service.memory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Detects user statements that carry an opinion, using a fixed list of marker phrases.
 *
 * <p>Matching is a case-insensitive substring search; when any marker is present the whole
 * statement is kept as the opinion.
 */
public final class OpinionExtractor {

    static final List<String> MARKERS = List.of(
            "i think", "i believe", "i love", "i hate", "i prefer", "i like",
            "i don't like", "my opinion", "in my view", "honestly", "actually",
            "i feel", "i disagree", "i agree");

    /**
     * @param text user utterance (may be null)
     * @return the trimmed utterance when it contains an opinion marker
     */
    public Optional<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : MARKERS) {
            if (lower.contains(marker)) {
                return Optional.of(text.trim());
            }
        }
        return Optional.empty();
    }
}
