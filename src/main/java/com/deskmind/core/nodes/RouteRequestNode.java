package com.deskmind.core.nodes;

import com.deskmind.core.config.EngineProperties;
import com.deskmind.core.llm.CompletionService;
import com.deskmind.core.llm.ReplyParser;
import com.deskmind.core.model.Route;
import com.deskmind.core.model.TaskStatus;
import com.deskmind.core.model.Turn;
import com.deskmind.core.state.ExecutionState;
import com.deskmind.core.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether the latest user turn is conversation or a task.
 * <p>
 * Cheap rules run first: empty input and greetings are conversation, task keywords
 * and registered tool names are tasks. Only when no rule fires is the completion
 * service asked for a one-word label; anything it cannot answer clearly is treated
 * as conversation.
 * <p>
 * On a resumed task (a human decision is waiting) classification is skipped and the
 * graph goes straight back to the verifier.
 */
@Component
public class RouteRequestNode {

    private static final Logger log = LoggerFactory.getLogger(RouteRequestNode.class);

    private static final String SYSTEM_PROMPT = """
            You are a strict classifier for a desktop assistant.
            Reply "task" when the user wants something done on the computer: opening or closing
            applications or websites, working with files, system commands, running or writing code,
            calculations, searching or downloading.
            Reply "chat" for greetings, general questions, explanations and small talk, and for
            requests too vague to act on.
            Reply with ONE WORD ONLY: task or chat.
            """;

    private final CompletionService completionService;
    private final ToolRegistry toolRegistry;
    private final Set<String> greetingKeywords;
    private final Set<String> taskKeywords;

    public RouteRequestNode(CompletionService completionService,
                            ToolRegistry toolRegistry,
                            EngineProperties properties) {
        this.completionService = completionService;
        this.toolRegistry = toolRegistry;
        this.greetingKeywords = lowerCased(properties.getGreetingKeywords());
        this.taskKeywords = lowerCased(properties.getTaskKeywords());
    }

    public Map<String, Object> apply(ExecutionState state) {
        if (state.humanDecision().isPresent()) {
            log.info("Resuming task {} after human decision {}", state.taskId(), state.humanDecision().get());
            return Map.of("status", TaskStatus.VERIFYING.name());
        }

        Route route = classify(state.latestUserText());
        log.info("Routed request as {}", route);

        var update = new HashMap<String, Object>();
        update.put("route", route.name());
        update.put("status", route == Route.TASK ? TaskStatus.PLANNING.name() : TaskStatus.EXECUTING.name());
        // a new request always starts from a clean slate
        update.put("subtaskIndex", 0);
        update.put("completedSubtasks", List.of());
        update.put("retryCounters", Map.of());
        update.put("attemptCounters", Map.of());
        update.put("userContext", "");
        update.put("verifierDecision", "");
        update.put("verifierReason", "");
        return update;
    }

    Route classify(String text) {
        if (text == null || text.isBlank()) {
            return Route.CONVERSATIONAL;
        }
        List<String> words = words(text);
        if (!words.isEmpty() && greetingKeywords.containsAll(words)) {
            return Route.CONVERSATIONAL;
        }
        if (words.stream().anyMatch(taskKeywords::contains)) {
            return Route.TASK;
        }
        if (namesRegisteredTool(text)) {
            return Route.TASK;
        }
        return askClassifier(text);
    }

    private boolean namesRegisteredTool(String text) {
        String normalized = text.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_]+", "_");
        return toolRegistry.contains(normalized);
    }

    private Route askClassifier(String text) {
        try {
            String reply = completionService.complete(SYSTEM_PROMPT, List.of(Turn.user(text)));
            String label = ReplyParser.firstWord(reply).toLowerCase(Locale.ROOT);
            return switch (label) {
                case "task", "planner" -> Route.TASK;
                case "chat", "conversation" -> Route.CONVERSATIONAL;
                default -> {
                    log.info("Classifier answered '{}', treating request as conversation",
                            ReplyParser.firstWord(reply));
                    yield Route.CONVERSATIONAL;
                }
            };
        } catch (RuntimeException e) {
            log.warn("Classifier call failed, treating request as conversation: {}", e.getMessage());
            return Route.CONVERSATIONAL;
        }
    }

    static List<String> words(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9']+"))
                .filter(w -> !w.isEmpty())
                .toList();
    }

    private static Set<String> lowerCased(List<String> keywords) {
        return keywords.stream()
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
