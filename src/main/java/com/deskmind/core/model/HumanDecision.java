package com.deskmind.core.model;

import java.util.Locale;

/**
 * Answer given at the human confirmation gate.
 */
public enum HumanDecision {
    YES,
    NO,
    ABORT;

    /**
     * Parses a free-text answer. Anything other than yes/no (and their one-letter
     * forms) is treated as {@link #ABORT}.
     */
    public static HumanDecision parse(String raw) {
        if (raw == null) {
            return ABORT;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "yes", "y" -> YES;
            case "no", "n" -> NO;
            default -> ABORT;
        };
    }
}
