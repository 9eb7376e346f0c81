package com.phillippitts.podcastbuddy.service.conversation;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** Recognises utterances that end the podcast. Whole-utterance match, case-insensitive. */
public final class StopPhraseDetector {

    private final Set<String> phrases;

    public StopPhraseDetector(List<String> phrases) {
        this.phrases = phrases.stream()
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .filter(p -> !p.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isStopPhrase(String utterance) {
        if (utterance == null) {
            return false;
        }
        return phrases.contains(utterance.trim().toLowerCase(Locale.ROOT));
    }
}
