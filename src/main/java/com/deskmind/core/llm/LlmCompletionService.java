package com.deskmind.core.llm;

import com.deskmind.core.config.EngineProperties;
import com.deskmind.core.model.ToolCall;
import com.deskmind.core.model.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * {@link CompletionService} backed by Spring AI's {@link ChatClient}.
 * <p>
 * The transcript window is rendered as chat messages: USER and SYSTEM turns map
 * one to one, ASSISTANT turns carry their tool calls as text, and TOOL turns are
 * fed back as user messages naming the tool. Each call runs on the
 * {@code completionExecutor} pool and is cancelled, interrupting its worker, after
 * {@code deskmind.engine.completion-timeout}.
 */
@Service
public class LlmCompletionService implements CompletionService {

    private static final Logger log = LoggerFactory.getLogger(LlmCompletionService.class);

    private final ChatClient chatClient;
    private final Executor executor;
    private final Duration timeout;

    @Autowired
    public LlmCompletionService(ChatClient.Builder builder,
                                @Qualifier("completionExecutor") Executor executor,
                                EngineProperties properties,
                                LlmProperties llmProperties,
                                @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this(builder.build(), executor, properties.getCompletionTimeout());
        log.info("LlmCompletionService initialized: provider={}, model={}, base-url={}",
                llmProperties.getProvider(),
                llmProperties.hasModel() ? llmProperties.getModel() : "(default)",
                baseUrl);
    }

    LlmCompletionService(ChatClient chatClient, Executor executor, Duration timeout) {
        this.chatClient = chatClient;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public String complete(String systemPrompt, List<Turn> window) {
        List<Message> messages = toMessages(window);
        log.debug("LLM call started ({} message(s))", messages.size());
        long start = System.currentTimeMillis();

        var task = new FutureTask<String>(() -> call(systemPrompt, messages));
        executor.execute(task);
        String response;
        try {
            response = task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("LLM call timed out after {}ms, cancelled", timeout.toMillis());
            throw new LlmTimeoutException(timeout);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("LLM call failed", e.getCause());
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the LLM", e);
        }

        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content."
                    + " Check that the model is running and reachable.");
        }
        return response;
    }

    private String call(String systemPrompt, List<Message> messages) {
        var request = chatClient.prompt();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            request = request.system(systemPrompt);
        }
        return request.messages(messages).call().content();
    }

    static List<Message> toMessages(List<Turn> window) {
        var messages = new ArrayList<Message>();
        for (Turn turn : window) {
            switch (turn.role()) {
                case USER -> messages.add(new UserMessage(turn.content()));
                case SYSTEM -> messages.add(new SystemMessage(turn.content()));
                case ASSISTANT -> messages.add(new AssistantMessage(renderAssistant(turn)));
                case TOOL -> messages.add(new UserMessage(
                        "Tool " + turn.toolName() + " returned:\n" + turn.content()));
            }
        }
        return messages;
    }

    private static String renderAssistant(Turn turn) {
        if (!turn.hasToolCalls()) {
            return turn.content();
        }
        String calls = turn.toolCalls().stream()
                .map(ToolCall::describe)
                .collect(Collectors.joining("\n"));
        return turn.content().isBlank() ? calls : turn.content() + "\n" + calls;
    }
}
