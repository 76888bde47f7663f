package com.deskmind.core.llm;

/**
 * Thrown when an LLM reply cannot be read as the JSON shape a node expects.
 */
public class LlmParseException extends RuntimeException {

    public LlmParseException(String message) {
        super(message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
