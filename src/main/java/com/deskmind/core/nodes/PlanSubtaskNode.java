package com.deskmind.core.nodes;

import com.deskmind.core.config.EngineProperties;
import com.deskmind.core.events.DeskmindEvent;
import com.deskmind.core.events.EventBus;
import com.deskmind.core.llm.CompletionService;
import com.deskmind.core.llm.LlmParseException;
import com.deskmind.core.llm.ReplyParser;
import com.deskmind.core.model.ExecutorKind;
import com.deskmind.core.model.FailureCode;
import com.deskmind.core.model.Subtask;
import com.deskmind.core.model.TaskStatus;
import com.deskmind.core.model.Turn;
import com.deskmind.core.state.ExecutionState;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Proposes the next subtask, one per call, or decides the task is done.
 * <p>
 * The completion service answers with {@code {"subtask": "...", "executor": "tool|code|chat"}};
 * {@code {"subtask": "done"}} or {@code {"done": true}} ends the task. A reply that cannot
 * be read also ends the task. A failed call is retried within the retry budget; when
 * every attempt fails the task ends with COLLABORATOR_UNAVAILABLE.
 */
@Component
public class PlanSubtaskNode {

    private static final Logger log = LoggerFactory.getLogger(PlanSubtaskNode.class);

    static final String SYSTEM_PROMPT = """
            You are the planner of a desktop assistant. Look at the conversation and decide the
            single next step needed to fulfil the user's latest request.

            Executors:
            - "tool": use one of the desktop tools (open apps, files, time, system actions)
            - "code": write and run a Python script (calculations, data processing)
            - "chat": answer in words only

            Reply with JSON only:
              {"subtask": "<one concrete step>", "executor": "tool" | "code" | "chat"}
            When every step of the request is already done, reply:
              {"subtask": "done"}
            """;

    private final CompletionService completionService;
    private final EventBus eventBus;
    private final int maxSubtasks;
    private final int maxAttempts;

    public PlanSubtaskNode(CompletionService completionService, EventBus eventBus, EngineProperties properties) {
        this.completionService = completionService;
        this.eventBus = eventBus;
        this.maxSubtasks = properties.getMaxSubtasks();
        this.maxAttempts = Math.max(0, properties.getMaxRetries()) + 1;
    }

    public Map<String, Object> apply(ExecutionState state) {
        Optional<String> reply = askPlanner(state);
        if (reply.isEmpty()) {
            log.error("Planner unreachable after {} attempt(s), failing task", maxAttempts);
            return Map.of(
                    "nextNode", "conclude",
                    "failureCode", FailureCode.COLLABORATOR_UNAVAILABLE.name()
            );
        }

        Optional<Subtask> next = parsePlan(reply.get(), state);
        if (next.isEmpty()) {
            log.info("Planner finished after {} subtask(s)", state.subtaskIndex());
            return Map.of("nextNode", "conclude", "status", TaskStatus.PLANNING.name());
        }

        Subtask subtask = next.get();
        if (subtask.index() >= maxSubtasks) {
            log.warn("Planner proposed subtask {} but the limit is {}", subtask.index() + 1, maxSubtasks);
            return Map.of(
                    "nextNode", "conclude",
                    "failureCode", FailureCode.SUBTASK_LIMIT_REACHED.name()
            );
        }

        log.info("Planned subtask {} [{}]: {}", subtask.index(), subtask.executorKind(), subtask.description());
        eventBus.publish(DeskmindEvent.of("subtask.planned", state.taskId(), subtask.index(),
                Map.of("description", subtask.description(), "executor", subtask.executorKind().name())));

        return Map.of(
                "currentSubtask", subtask,
                "currentExecutorKind", subtask.executorKind().name(),
                "nextNode", targetFor(subtask.executorKind()),
                "status", TaskStatus.EXECUTING.name()
        );
    }

    private Optional<String> askPlanner(ExecutionState state) {
        String prompt = systemPrompt(state.completedSubtasks());
        List<Turn> window = window(state);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return Optional.of(completionService.complete(prompt, window));
            } catch (RuntimeException e) {
                log.warn("Planner call {}/{} failed: {}", attempt, maxAttempts, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private static Optional<Subtask> parsePlan(String reply, ExecutionState state) {
        JsonNode plan;
        try {
            plan = ReplyParser.requireJson(reply);
        } catch (LlmParseException e) {
            log.warn("Planner reply unreadable, ending task: {}", e.getMessage());
            return Optional.empty();
        }
        if (!plan.isObject()) {
            log.warn("Planner reply is not a JSON object, ending task: {}", reply);
            return Optional.empty();
        }
        if (plan.path("done").asBoolean(false)) {
            return Optional.empty();
        }
        String description = plan.path("subtask").asText("").trim();
        if (description.isEmpty() || description.equalsIgnoreCase("done")) {
            return Optional.empty();
        }
        ExecutorKind kind = ExecutorKind.fromLabel(plan.path("executor").asText(null));
        return Optional.of(new Subtask(description, kind, state.subtaskIndex()));
    }

    static String systemPrompt(List<String> completed) {
        if (completed.isEmpty()) {
            return SYSTEM_PROMPT;
        }
        var sb = new StringBuilder(SYSTEM_PROMPT).append("\nSteps already completed successfully:\n");
        for (int i = 0; i < completed.size(); i++) {
            sb.append(i + 1).append(". ").append(completed.get(i)).append('\n');
        }
        return sb.toString();
    }

    private static List<Turn> window(ExecutionState state) {
        var turns = new ArrayList<>(state.recentTurns(20));
        if (turns.isEmpty()) {
            turns.add(Turn.user(state.request()));
        }
        return turns;
    }

    static String targetFor(ExecutorKind kind) {
        return switch (kind) {
            case CONVERSATIONAL -> "converse";
            case CODE_GENERATING -> "generate_code";
            case TOOL_SELECTING -> "select_tool";
        };
    }
}
