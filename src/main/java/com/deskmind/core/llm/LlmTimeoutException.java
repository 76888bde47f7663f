package com.deskmind.core.llm;

import java.time.Duration;

/**
 * Thrown when a completion call does not answer within the configured timeout.
 */
public class LlmTimeoutException extends RuntimeException {

    public LlmTimeoutException(Duration timeout) {
        super("LLM did not respond within " + timeout.toSeconds() + "s");
    }
}
