package com.deskmind.core.nodes;

import com.deskmind.core.config.EngineProperties;
import com.deskmind.core.events.DeskmindEvent;
import com.deskmind.core.events.EventBus;
import com.deskmind.core.human.HumanChannel;
import com.deskmind.core.human.HumanMode;
import com.deskmind.core.metrics.DeskmindMetrics;
import com.deskmind.core.model.HumanDecision;
import com.deskmind.core.model.HumanReply;
import com.deskmind.core.model.Role;
import com.deskmind.core.model.Subtask;
import com.deskmind.core.model.TaskStatus;
import com.deskmind.core.model.Turn;
import com.deskmind.core.state.ExecutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Human confirmation gate, reached when the verifier cannot decide.
 * <p>
 * In BLOCKING mode the {@link HumanChannel} is asked inline and the answer goes
 * straight back to the verifier. In SUSPEND mode (or when no channel is available)
 * the task stops with status AWAITING_HUMAN and the question as its final message;
 * the engine resumes it later with the answer.
 */
@Component
public class ConfirmWithUserNode {

    private static final Logger log = LoggerFactory.getLogger(ConfirmWithUserNode.class);

    private final HumanChannel humanChannel;
    private final HumanMode mode;
    private final EventBus eventBus;
    private final DeskmindMetrics metrics;

    public ConfirmWithUserNode(@Autowired(required = false) HumanChannel humanChannel,
                               EngineProperties properties,
                               EventBus eventBus,
                               DeskmindMetrics metrics) {
        this.humanChannel = humanChannel;
        this.mode = properties.getHumanMode();
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ExecutionState state) {
        int gate = state.gateCount() + 1;
        String question = question(state);

        if (mode == HumanMode.SUSPEND || humanChannel == null) {
            log.info("Suspending at gate {} for a human answer", gate);
            eventBus.publish(DeskmindEvent.of("task.suspended", state.taskId(), state.subtaskIndex(),
                    Map.of("gate", gate, "question", question)));
            return Map.of(
                    "gateCount", gate,
                    "status", TaskStatus.AWAITING_HUMAN.name(),
                    "finalMessage", question
            );
        }

        HumanReply reply;
        try {
            reply = humanChannel.ask(question);
        } catch (RuntimeException e) {
            log.warn("Human channel failed, treating as abort: {}", e.getMessage());
            reply = new HumanReply(HumanDecision.ABORT, "");
        }
        log.info("Gate {} answered {}", gate, reply.decision());
        metrics.recordHumanGate(reply.decision().name());
        return Map.of(
                "gateCount", gate,
                "humanDecision", reply.decision().name(),
                "humanContext", reply.context(),
                "status", TaskStatus.VERIFYING.name()
        );
    }

    static String question(ExecutionState state) {
        String step = state.currentSubtask().map(Subtask::description).orElse(state.latestUserText());
        String result = latestResult(state.turnsOfLastAttempt());
        return "I tried to: " + step + "\n"
                + "Result: " + (result.isBlank() ? "(nothing to show)" : result) + "\n"
                + "Did this work? (yes / no / abort)";
    }

    private static String latestResult(List<Turn> attempt) {
        for (int i = attempt.size() - 1; i >= 0; i--) {
            Turn turn = attempt.get(i);
            if (turn.role() == Role.TOOL && !turn.content().isBlank()) {
                return turn.content();
            }
        }
        return attempt.isEmpty() ? "" : attempt.get(0).content();
    }
}
