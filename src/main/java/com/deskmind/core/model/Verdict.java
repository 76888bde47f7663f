package com.deskmind.core.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * The verifier's judgement on the last action.
 */
public enum Verdict {
    SUCCESS(Set.of("success")),
    RETRY(Set.of("retry", "retry_tool")),
    ESCALATE(Set.of("escalate", "fallback_coder")),
    USER_VERIFIER(Set.of("user_verifier", "userverifier")),
    FAILURE(Set.of("failure"));

    private final Set<String> words;

    Verdict(Set<String> words) {
        this.words = words;
    }

    /**
     * Case-folds and trims {@code word} and matches it against the vocabulary.
     * Empty when the word is not a verdict.
     */
    public static Optional<Verdict> match(String word) {
        if (word == null) {
            return Optional.empty();
        }
        String normalized = word.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (Verdict v : values()) {
            if (v.words.contains(normalized)) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }
}
