package com.deskmind.core.llm;

import com.deskmind.core.model.Turn;

import java.util.List;

/**
 * Text-completion collaborator used at every decision point of the engine.
 * <p>
 * Implementations must be thread-safe and bound every call by a timeout.
 * Failures surface as unchecked exceptions ({@link LlmTimeoutException},
 * {@link LlmEmptyResponseException} or whatever the transport throws).
 */
public interface CompletionService {

    /**
     * @param systemPrompt instructions for the model's role
     * @param window       the transcript turns the model should see, oldest first
     * @return the model's reply text, never blank
     */
    String complete(String systemPrompt, List<Turn> window);
}
