package com.deskmind.core.nodes;

import com.deskmind.core.config.EngineProperties;
import com.deskmind.core.events.DeskmindEvent;
import com.deskmind.core.events.EventBus;
import com.deskmind.core.llm.CompletionService;
import com.deskmind.core.llm.ReplyParser;
import com.deskmind.core.metrics.DeskmindMetrics;
import com.deskmind.core.model.ExecutorKind;
import com.deskmind.core.model.FailureCode;
import com.deskmind.core.model.HumanDecision;
import com.deskmind.core.model.Role;
import com.deskmind.core.model.Subtask;
import com.deskmind.core.model.TaskStatus;
import com.deskmind.core.model.Verdict;
import com.deskmind.core.state.ExecutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Judges whether the last action satisfied the current subtask.
 * <p>
 * Deterministic short-circuits run first and skip the completion service:
 * <ol>
 *   <li>a pending human decision (abort, yes, no)</li>
 *   <li>a tool that turned out to be unavailable: ESCALATE</li>
 *   <li>a collaborator failure during the attempt: RETRY</li>
 *   <li>no TOOL turn produced by the attempt: USER_VERIFIER</li>
 * </ol>
 * Otherwise the model is asked for one verdict word and a reason. Anything it says
 * that is not a verdict, and any failed call, becomes USER_VERIFIER: the verifier
 * never guesses SUCCESS or FAILURE.
 */
@Component
public class VerifyResultNode {

    private static final Logger log = LoggerFactory.getLogger(VerifyResultNode.class);

    private static final String SYSTEM_PROMPT = """
            You check the work of a desktop assistant. Given the step it was asked to do and
            the tool results that followed, answer with exactly one word, then one sentence of reason:
              success       - the step is done
              retry         - the attempt failed but trying again may work
              escalate      - the tools cannot do this; code should be written instead
              user_verifier - you cannot tell from the output; ask the user
              failure       - the step cannot be done at all

            Step: %s
            Executor: %s
            Attempt: %d
            %s
            """;

    static final String NOT_RIGHT = "The user said the result was not right.";

    private final CompletionService completionService;
    private final EventBus eventBus;
    private final DeskmindMetrics metrics;
    private final int window;

    public VerifyResultNode(CompletionService completionService,
                            EventBus eventBus,
                            DeskmindMetrics metrics,
                            EngineProperties properties) {
        this.completionService = completionService;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.window = properties.getVerifierWindow();
    }

    public Map<String, Object> apply(ExecutionState state) {
        var update = new HashMap<String, Object>();
        Judgement judgement = judge(state, update);

        ExecutorKind kind = state.currentExecutorKind().orElse(ExecutorKind.TOOL_SELECTING);
        log.info("Verdict {} for subtask {} ({}): {}", judgement.verdict(), state.subtaskIndex(), kind,
                judgement.reason());
        metrics.recordVerdict(judgement.verdict().name(), kind.name());
        eventBus.publish(DeskmindEvent.of("verdict.issued", state.taskId(), state.subtaskIndex(),
                Map.of("verdict", judgement.verdict().name(),
                        "executor", kind.name(),
                        "reason", judgement.reason())));

        update.put("verifierDecision", judgement.verdict().name());
        update.put("verifierReason", judgement.reason());
        update.put("status", TaskStatus.VERIFYING.name());
        return update;
    }

    record Judgement(Verdict verdict, String reason) {}

    private Judgement judge(ExecutionState state, Map<String, Object> update) {
        Optional<HumanDecision> decision = state.humanDecision();
        if (decision.isPresent()) {
            // consume the answer so it is not applied twice
            update.put("humanDecision", "");
            update.put("humanContext", "");
            switch (decision.get()) {
                case ABORT:
                    update.put("failureCode", FailureCode.USER_ABORT.name());
                    return new Judgement(Verdict.FAILURE, "The user aborted the task.");
                case YES:
                    return new Judgement(Verdict.SUCCESS, "The user confirmed the result.");
                default:
                    String context = state.humanContext().isBlank() ? NOT_RIGHT : state.humanContext();
                    update.put("userContext", context);
                    return new Judgement(Verdict.RETRY, "The user rejected the result: " + context);
            }
        }

        if (!state.unavailableTools().isEmpty()) {
            return new Judgement(Verdict.ESCALATE,
                    "Tool(s) not available: " + String.join(", ", state.unavailableTools()));
        }

        if (!state.attemptFailure().isBlank()) {
            return new Judgement(Verdict.RETRY, "The attempt did not complete: " + state.attemptFailure());
        }

        boolean producedToolOutput = state.turnsOfLastAttempt().stream()
                .anyMatch(turn -> turn.role() == Role.TOOL);
        if (!producedToolOutput) {
            return new Judgement(Verdict.USER_VERIFIER, "No tool ran, so the result cannot be checked.");
        }

        return askModel(state);
    }

    private Judgement askModel(ExecutionState state) {
        ExecutorKind kind = state.currentExecutorKind().orElse(ExecutorKind.TOOL_SELECTING);
        String step = state.currentSubtask().map(Subtask::description).orElse(state.latestUserText());
        String context = state.userContext().isBlank() ? "" : "User context: " + state.userContext();
        String prompt = String.format(SYSTEM_PROMPT, step, kind, state.attemptCount(kind), context);

        String reply;
        try {
            reply = completionService.complete(prompt, state.recentTurns(window));
        } catch (RuntimeException e) {
            log.warn("Verifier call failed, asking the user: {}", e.getMessage());
            return new Judgement(Verdict.USER_VERIFIER, "The verifier could not be reached.");
        }

        String word = ReplyParser.firstWord(reply);
        Optional<Verdict> verdict = Verdict.match(word);
        if (verdict.isEmpty()) {
            log.info("Unrecognized verdict '{}', asking the user", word);
            return new Judgement(Verdict.USER_VERIFIER, "The verifier's answer was unclear.");
        }
        return new Judgement(verdict.get(), firstSentence(ReplyParser.afterFirstWord(reply)));
    }

    static String firstSentence(String text) {
        String trimmed = text.replaceFirst("^[\\s:\\-.,]+", "").strip();
        int end = trimmed.indexOf(". ");
        return end < 0 ? trimmed : trimmed.substring(0, end + 1);
    }
}
